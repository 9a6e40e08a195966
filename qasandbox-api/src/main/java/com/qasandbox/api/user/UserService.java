package com.qasandbox.api.user;

import com.qasandbox.api.admin.AdminAuditService;
import com.qasandbox.api.common.OffsetPageRequest;
import com.qasandbox.domain.NotFoundException;
import com.qasandbox.domain.access.AccessPolicy;
import com.qasandbox.domain.access.Action;
import com.qasandbox.domain.access.Principal;
import com.qasandbox.domain.access.ResourceType;
import com.qasandbox.domain.access.Role;
import com.qasandbox.infrastructure.order.OrderRepository;
import com.qasandbox.infrastructure.user.UserEntity;
import com.qasandbox.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserRepository users;
  private final OrderRepository orders;
  private final AccessPolicy accessPolicy;
  private final AdminAuditService audit;

  public UserService(UserRepository users, OrderRepository orders, AccessPolicy accessPolicy, AdminAuditService audit) {
    this.users = users;
    this.orders = orders;
    this.accessPolicy = accessPolicy;
    this.audit = audit;
  }

  public record UserUpdate(String email, String username, String fullName, String role, Boolean isActive) {}

  @Transactional(readOnly = true)
  public List<UserEntity> list(Principal principal, Role role, Boolean isActive, int skip, int limit) {
    accessPolicy.require(principal, Action.READ, ResourceType.USER);

    Specification<UserEntity> spec = Specification.where(null);
    if (role != null) {
      spec = spec.and((root, q, cb) -> cb.equal(root.get("role"), role.value()));
    }
    if (isActive != null) {
      spec = spec.and((root, q, cb) -> cb.equal(root.get("active"), isActive));
    }
    return users.findAll(spec, OffsetPageRequest.of(skip, limit, Sort.by("id"))).getContent();
  }

  @Transactional(readOnly = true)
  public UserEntity get(Principal principal, long id) {
    accessPolicy.require(principal, Action.READ, ResourceType.USER);
    return load(id);
  }

  /**
   * @throws IllegalArgumentException when the new email or username belongs to another user
   */
  @Transactional
  public UserEntity update(Principal principal, long id, UserUpdate update) {
    accessPolicy.require(principal, Action.UPDATE, ResourceType.USER);
    UserEntity user = load(id);

    if (update.email() != null) {
      String email = update.email().trim().toLowerCase(Locale.ROOT);
      users.findByEmailIgnoreCase(email)
          .filter(other -> !other.getId().equals(user.getId()))
          .ifPresent(other -> {
            throw new IllegalArgumentException("Email already in use");
          });
      user.setEmail(email);
    }
    if (update.username() != null) {
      String username = update.username().trim();
      users.findByUsername(username)
          .filter(other -> !other.getId().equals(user.getId()))
          .ifPresent(other -> {
            throw new IllegalArgumentException("Username already in use");
          });
      user.setUsername(username);
    }
    if (update.fullName() != null) user.setFullName(update.fullName());
    if (update.role() != null) user.setRole(Role.fromValue(update.role()).value());
    if (update.isActive() != null) user.setActive(update.isActive());
    user.setUpdatedAt(Instant.now());

    log.info("User updated: userId={}, by={}", id, principal.id());
    return user;
  }

  /**
   * Deletes the user together with their orders. An admin cannot delete their own account.
   */
  @Transactional
  public void delete(Principal principal, long id) {
    accessPolicy.require(principal, Action.DELETE, ResourceType.USER);
    if (principal.owns(id)) {
      throw new IllegalArgumentException("Cannot delete yourself");
    }
    UserEntity user = load(id);
    orders.deleteByUserId(id);
    users.delete(user);
    audit.log(principal, "USER_DELETE", "user", String.valueOf(id));
    log.info("User deleted: userId={}, by={}", id, principal.id());
  }

  private UserEntity load(long id) {
    return users.findById(id).orElseThrow(() -> new NotFoundException(ResourceType.USER, id));
  }
}

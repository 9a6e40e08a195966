package com.qasandbox.api.catalog;

import com.qasandbox.api.common.OffsetPageRequest;
import com.qasandbox.domain.NotFoundException;
import com.qasandbox.domain.access.AccessPolicy;
import com.qasandbox.domain.access.Action;
import com.qasandbox.domain.access.Principal;
import com.qasandbox.domain.access.ResourceType;
import com.qasandbox.infrastructure.catalog.CategoryEntity;
import com.qasandbox.infrastructure.catalog.CategoryRepository;
import com.qasandbox.infrastructure.catalog.ProductRepository;
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
public class CategoryService {

  private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

  private final CategoryRepository categories;
  private final ProductRepository products;
  private final AccessPolicy accessPolicy;

  public CategoryService(CategoryRepository categories, ProductRepository products, AccessPolicy accessPolicy) {
    this.categories = categories;
    this.products = products;
    this.accessPolicy = accessPolicy;
  }

  public record CategoryUpdate(String name, String description, Boolean isActive) {}

  @Transactional(readOnly = true)
  public List<CategoryEntity> list(Principal principal, Boolean isActive, String search, int skip, int limit) {
    accessPolicy.require(principal, Action.READ, ResourceType.CATEGORY);

    Specification<CategoryEntity> spec = Specification.where(null);
    if (isActive != null) {
      spec = spec.and((root, q, cb) -> cb.equal(root.get("active"), isActive));
    }
    if (search != null && !search.isBlank()) {
      String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
      spec = spec.and((root, q, cb) -> cb.like(cb.lower(root.get("name")), pattern));
    }
    return categories.findAll(spec, OffsetPageRequest.of(skip, limit, Sort.by("id"))).getContent();
  }

  @Transactional(readOnly = true)
  public CategoryEntity get(Principal principal, long id) {
    accessPolicy.require(principal, Action.READ, ResourceType.CATEGORY);
    return load(id);
  }

  @Transactional
  public CategoryEntity create(Principal principal, String name, String description) {
    accessPolicy.require(principal, Action.CREATE, ResourceType.CATEGORY);
    String trimmed = name.trim();
    if (categories.findByName(trimmed).isPresent()) {
      throw new IllegalArgumentException("Category name already exists");
    }
    CategoryEntity saved = categories.save(new CategoryEntity(trimmed, description, Instant.now()));
    log.info("Category created: categoryId={}, by={}", saved.getId(), principal.id());
    return saved;
  }

  @Transactional
  public CategoryEntity update(Principal principal, long id, CategoryUpdate update) {
    accessPolicy.require(principal, Action.UPDATE, ResourceType.CATEGORY);
    CategoryEntity category = load(id);
    if (update.name() != null) {
      String trimmed = update.name().trim();
      categories.findByName(trimmed)
          .filter(other -> !other.getId().equals(category.getId()))
          .ifPresent(other -> {
            throw new IllegalArgumentException("Category name already exists");
          });
      category.setName(trimmed);
    }
    if (update.description() != null) category.setDescription(update.description());
    if (update.isActive() != null) category.setActive(update.isActive());
    return category;
  }

  /** Deletes the category; its products stay and lose their category reference. */
  @Transactional
  public void delete(Principal principal, long id) {
    accessPolicy.require(principal, Action.DELETE, ResourceType.CATEGORY);
    CategoryEntity category = load(id);
    int detached = products.detachFromCategory(id);
    categories.delete(category);
    log.info("Category deleted: categoryId={}, detachedProducts={}, by={}", id, detached, principal.id());
  }

  private CategoryEntity load(long id) {
    return categories.findById(id).orElseThrow(() -> new NotFoundException(ResourceType.CATEGORY, id));
  }
}

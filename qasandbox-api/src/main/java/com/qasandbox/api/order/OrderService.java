package com.qasandbox.api.order;

import com.qasandbox.api.common.OffsetPageRequest;
import com.qasandbox.domain.NotFoundException;
import com.qasandbox.domain.access.AccessPolicy;
import com.qasandbox.domain.access.Action;
import com.qasandbox.domain.access.Principal;
import com.qasandbox.domain.access.ResourceType;
import com.qasandbox.domain.access.VisibilityFilter;
import com.qasandbox.domain.order.InsufficientStockException;
import com.qasandbox.domain.order.OrderLifecycle;
import com.qasandbox.domain.order.OrderLine;
import com.qasandbox.domain.order.OrderStatus;
import com.qasandbox.infrastructure.catalog.ProductEntity;
import com.qasandbox.infrastructure.catalog.ProductRepository;
import com.qasandbox.infrastructure.order.OrderEntity;
import com.qasandbox.infrastructure.order.OrderItemEmbeddable;
import com.qasandbox.infrastructure.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Order use cases. Every public method is one transaction.
 *
 * Invariants:
 * - Stock is only changed while the product rows are locked (ascending id order).
 * - Creation is all-or-nothing: any failing line rolls back every decrement.
 * - Orders the principal may not see behave exactly like missing orders.
 */
@Service
public class OrderService {

  private static final Logger log = LoggerFactory.getLogger(OrderService.class);

  private final OrderRepository orders;
  private final ProductRepository products;
  private final AccessPolicy accessPolicy;
  private final VisibilityFilter visibility;
  private final OrderLifecycle lifecycle;
  private final OrderNumberGenerator orderNumbers;

  public OrderService(
      OrderRepository orders,
      ProductRepository products,
      AccessPolicy accessPolicy,
      VisibilityFilter visibility,
      OrderLifecycle lifecycle,
      OrderNumberGenerator orderNumbers
  ) {
    this.orders = orders;
    this.products = products;
    this.accessPolicy = accessPolicy;
    this.visibility = visibility;
    this.lifecycle = lifecycle;
    this.orderNumbers = orderNumbers;
  }

  public record ItemRequest(long productId, int quantity) {}

  /** Partial update: null fields are left untouched. */
  public record OrderUpdate(OrderStatus status, String shippingAddress, String notes) {}

  @Transactional
  public OrderEntity create(Principal principal, List<ItemRequest> items, String shippingAddress, String notes) {
    accessPolicy.require(principal, Action.CREATE, ResourceType.ORDER);
    Map<Long, Integer> requested = merge(items);

    Map<Long, ProductEntity> locked = new LinkedHashMap<>();
    for (ProductEntity p : products.lockAllByIdIn(requested.keySet())) {
      locked.put(p.getId(), p);
    }
    List<Long> missing = requested.keySet().stream().filter(id -> !locked.containsKey(id)).toList();
    if (!missing.isEmpty()) {
      throw new IllegalArgumentException("Products not found: " + missing);
    }
    List<Long> inactive = locked.values().stream().filter(p -> !p.isActive()).map(ProductEntity::getId).toList();
    if (!inactive.isEmpty()) {
      throw new IllegalArgumentException("Products inactive: " + inactive);
    }

    List<OrderLine> lines = new ArrayList<>();
    for (ProductEntity p : locked.values()) {
      int quantity = requested.get(p.getId());
      if (quantity > p.getStock()) {
        log.warn("Stock reservation rejected: productId={}, requested={}, available={}, userId={}",
            p.getId(), quantity, p.getStock(), principal.id());
        throw new InsufficientStockException(p.getId(), quantity, p.getStock());
      }
      lines.add(new OrderLine(p.getId(), quantity, p.getPrice()));
    }

    Instant now = Instant.now();
    for (OrderLine line : lines) {
      ProductEntity p = locked.get(line.productId());
      p.setStock(p.getStock() - line.quantity());
      p.setUpdatedAt(now);
    }

    OrderEntity order = orders.save(new OrderEntity(
        orderNumbers.next(),
        principal.id(),
        lifecycle.initial().value(),
        OrderLine.total(lines),
        shippingAddress,
        notes,
        lines.stream().map(l -> new OrderItemEmbeddable(l.productId(), l.quantity(), l.unitPrice())).toList(),
        now
    ));
    log.info("Order created: orderId={}, orderNumber={}, userId={}, total={}",
        order.getId(), order.getOrderNumber(), principal.id(), order.getTotalAmount());
    return order;
  }

  /**
   * Lists orders newest first. Viewers are scoped to their own orders in the query itself,
   * the {@code userId} filter is ignored for them.
   */
  @Transactional(readOnly = true)
  public List<OrderEntity> list(Principal principal, OrderStatus status, Long userId, int skip, int limit) {
    accessPolicy.require(principal, Action.READ, ResourceType.ORDER);

    Optional<Long> scope = visibility.ownerScope(principal);
    Long owner = scope.orElse(userId);

    Specification<OrderEntity> spec = Specification.where(null);
    if (owner != null) {
      spec = spec.and((root, q, cb) -> cb.equal(root.get("userId"), owner));
    }
    if (status != null) {
      spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), status.value()));
    }
    Sort sort = Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id"));
    List<OrderEntity> page = orders.findAll(spec, OffsetPageRequest.of(skip, limit, sort)).getContent();
    return visibility.filterVisible(principal, page, OrderEntity::getUserId);
  }

  @Transactional(readOnly = true)
  public OrderEntity get(Principal principal, long id) {
    OrderEntity order = loadVisible(principal, id, false);
    accessPolicy.require(principal, Action.READ, ResourceType.ORDER, order.getUserId());
    return order;
  }

  /**
   * Changes status (through the lifecycle), shipping address and notes.
   * A target status of CANCELLED goes through {@link #cancel} semantics and restores stock.
   */
  @Transactional
  public OrderEntity update(Principal principal, long id, OrderUpdate update) {
    OrderEntity order = loadVisible(principal, id, true);
    accessPolicy.require(principal, Action.UPDATE, ResourceType.ORDER, order.getUserId());

    OrderStatus current = OrderStatus.fromValue(order.getStatus());
    if (update.status() != null && update.status() != current) {
      if (update.status() == OrderStatus.CANCELLED) {
        applyCancel(order, current);
      } else {
        order.setStatus(lifecycle.transition(current, update.status()).value());
        log.info("Order status changed: orderId={}, from={}, to={}, by={}",
            id, current.value(), update.status().value(), principal.id());
      }
    }
    if (update.shippingAddress() != null) order.setShippingAddress(update.shippingAddress());
    if (update.notes() != null) order.setNotes(update.notes());
    order.setUpdatedAt(Instant.now());
    return order;
  }

  @Transactional
  public OrderEntity cancel(Principal principal, long id) {
    OrderEntity order = loadVisible(principal, id, true);
    accessPolicy.require(principal, Action.CANCEL, ResourceType.ORDER, order.getUserId());
    applyCancel(order, OrderStatus.fromValue(order.getStatus()));
    order.setUpdatedAt(Instant.now());
    log.info("Order cancelled: orderId={}, by={}", id, principal.id());
    return order;
  }

  /** Removes the order record. Stock is not touched. */
  @Transactional
  public void delete(Principal principal, long id) {
    OrderEntity order = loadVisible(principal, id, false);
    accessPolicy.require(principal, Action.DELETE, ResourceType.ORDER, order.getUserId());
    orders.delete(order);
    log.info("Order deleted: orderId={}, by={}", id, principal.id());
  }

  private void applyCancel(OrderEntity order, OrderStatus current) {
    order.setStatus(lifecycle.cancel(current).value());

    TreeSet<Long> ids = new TreeSet<>();
    order.getItems().forEach(i -> ids.add(i.getProductId()));
    Map<Long, ProductEntity> locked = new LinkedHashMap<>();
    for (ProductEntity p : products.lockAllByIdIn(ids)) {
      locked.put(p.getId(), p);
    }
    Instant now = Instant.now();
    for (OrderItemEmbeddable item : order.getItems()) {
      ProductEntity p = locked.get(item.getProductId());
      if (p == null) {
        // product deleted since the order was placed
        continue;
      }
      p.setStock(p.getStock() + item.getQuantity());
      p.setUpdatedAt(now);
    }
  }

  private OrderEntity loadVisible(Principal principal, long id, boolean forUpdate) {
    Optional<OrderEntity> found = forUpdate ? orders.lockById(id) : orders.findById(id);
    return found
        .filter(o -> visibility.isVisible(principal, o.getUserId()))
        .orElseThrow(() -> new NotFoundException(ResourceType.ORDER, id));
  }

  /**
   * Sums quantities of repeated product ids, keyed in ascending id order.
   *
   * @throws IllegalArgumentException when no items are given, a quantity is not positive
   *     or the summed quantity of one product overflows an int
   */
  static Map<Long, Integer> merge(List<ItemRequest> items) {
    if (items == null || items.isEmpty()) {
      throw new IllegalArgumentException("Order must contain at least one item");
    }
    Map<Long, Integer> merged = new TreeMap<>();
    for (ItemRequest item : items) {
      if (item.quantity() <= 0) {
        throw new IllegalArgumentException("Quantity must be positive for product " + item.productId());
      }
      try {
        merged.merge(item.productId(), item.quantity(), Math::addExact);
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("Quantity too large for product " + item.productId());
      }
    }
    return merged;
  }
}

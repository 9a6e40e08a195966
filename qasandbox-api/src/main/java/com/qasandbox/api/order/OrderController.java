package com.qasandbox.api.order;

import com.qasandbox.api.security.PrincipalResolver;
import com.qasandbox.domain.order.OrderStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/orders")
public class OrderController {

  private final OrderService orders;
  private final PrincipalResolver principals;

  public OrderController(OrderService orders, PrincipalResolver principals) {
    this.orders = orders;
    this.principals = principals;
  }

  public record ItemRequest(
      @NotNull Long productId,
      @NotNull @Min(1) Integer quantity
  ) {}

  /**
   * {@code productIds} is the short form: each id is ordered once.
   */
  public record CreateOrderRequest(
      List<@Valid ItemRequest> items,
      List<Long> productIds,
      String shippingAddress,
      String notes
  ) {}

  public record UpdateOrderRequest(String status, String shippingAddress, String notes) {}

  @GetMapping
  public List<OrderView> list(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) Long userId,
      @RequestParam(defaultValue = "0") int skip,
      @RequestParam(defaultValue = "20") int limit
  ) {
    OrderStatus statusFilter = status == null ? null : OrderStatus.fromValue(status);
    return orders.list(principals.resolve(jwt), statusFilter, userId, skip, limit).stream()
        .map(OrderView::from)
        .toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public OrderView create(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateOrderRequest req) {
    List<OrderService.ItemRequest> items = new ArrayList<>();
    if (req.items() != null) {
      req.items().forEach(i -> items.add(new OrderService.ItemRequest(i.productId(), i.quantity())));
    }
    if (req.productIds() != null) {
      req.productIds().forEach(id -> items.add(new OrderService.ItemRequest(id, 1)));
    }
    return OrderView.from(orders.create(principals.resolve(jwt), items, req.shippingAddress(), req.notes()));
  }

  @GetMapping("/{id}")
  public OrderView get(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    return OrderView.from(orders.get(principals.resolve(jwt), id));
  }

  @PutMapping("/{id}")
  public OrderView update(@AuthenticationPrincipal Jwt jwt, @PathVariable long id, @RequestBody UpdateOrderRequest req) {
    OrderStatus status = req.status() == null ? null : OrderStatus.fromValue(req.status());
    var update = new OrderService.OrderUpdate(status, req.shippingAddress(), req.notes());
    return OrderView.from(orders.update(principals.resolve(jwt), id, update));
  }

  @PostMapping("/{id}/cancel")
  public OrderView cancel(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    return OrderView.from(orders.cancel(principals.resolve(jwt), id));
  }

  @DeleteMapping("/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    orders.delete(principals.resolve(jwt), id);
  }
}

package com.qasandbox.domain.order;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderLifecycleTest {

  private final OrderLifecycle lifecycle = new OrderLifecycle();

  @Test
  void newOrdersStartPending() {
    assertThat(lifecycle.initial()).isEqualTo(OrderStatus.PENDING);
  }

  @ParameterizedTest(name = "{0} -> {1}: {2}")
  @CsvSource({
      "PENDING,   PENDING,   false",
      "PENDING,   CONFIRMED, true",
      "PENDING,   SHIPPED,   false",
      "PENDING,   CANCELLED, true",
      "CONFIRMED, PENDING,   false",
      "CONFIRMED, CONFIRMED, false",
      "CONFIRMED, SHIPPED,   true",
      "CONFIRMED, CANCELLED, false",
      "SHIPPED,   PENDING,   false",
      "SHIPPED,   CONFIRMED, false",
      "SHIPPED,   SHIPPED,   false",
      "SHIPPED,   CANCELLED, false",
      "CANCELLED, PENDING,   false",
      "CANCELLED, CONFIRMED, false",
      "CANCELLED, SHIPPED,   false",
      "CANCELLED, CANCELLED, false"
  })
  void transitionTable(OrderStatus from, OrderStatus to, boolean allowed) {
    assertThat(lifecycle.canTransition(from, to)).isEqualTo(allowed);
  }

  @Test
  void skippingConfirmedIsRejected() {
    assertThatThrownBy(() -> lifecycle.transition(OrderStatus.PENDING, OrderStatus.SHIPPED))
        .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
          assertThat(e.from()).isEqualTo(OrderStatus.PENDING);
          assertThat(e.to()).isEqualTo(OrderStatus.SHIPPED);
        });
  }

  @Test
  void fullChainWalksForward() {
    OrderStatus s = lifecycle.initial();
    s = lifecycle.transition(s, OrderStatus.CONFIRMED);
    s = lifecycle.transition(s, OrderStatus.SHIPPED);
    assertThat(s).isEqualTo(OrderStatus.SHIPPED);
    assertThat(s.isTerminal()).isTrue();
  }

  @ParameterizedTest
  @EnumSource(value = OrderStatus.class, names = {"CONFIRMED", "SHIPPED", "CANCELLED"})
  void cancelOnlyFromPending(OrderStatus from) {
    assertThatThrownBy(() -> lifecycle.cancel(from))
        .isInstanceOf(InvalidTransitionException.class)
        .hasMessageContaining("Only pending orders can be cancelled");
  }

  @Test
  void cancelPending() {
    assertThat(lifecycle.cancel(OrderStatus.PENDING)).isEqualTo(OrderStatus.CANCELLED);
  }

  @Test
  void statusParsingIsStrict() {
    assertThat(OrderStatus.fromValue("confirmed")).isEqualTo(OrderStatus.CONFIRMED);
    assertThatThrownBy(() -> OrderStatus.fromValue("delivered")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void totalIsSumOfPriceTimesQuantity() {
    List<OrderLine> lines = List.of(
        new OrderLine(1L, 2, new BigDecimal("1299.99")),
        new OrderLine(2L, 3, new BigDecimal("49.99"))
    );
    assertThat(OrderLine.total(lines)).isEqualByComparingTo("2749.95");
  }

  @Test
  void lineRejectsNonPositiveQuantity() {
    assertThatThrownBy(() -> new OrderLine(1L, 0, BigDecimal.ONE)).isInstanceOf(IllegalArgumentException.class);
  }
}

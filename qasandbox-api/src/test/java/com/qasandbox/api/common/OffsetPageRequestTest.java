package com.qasandbox.api.common;

import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OffsetPageRequestTest {

  @Test
  void offsetNeedNotBeAMultipleOfLimit() {
    var page = OffsetPageRequest.of(7, 5, Sort.unsorted());
    assertThat(page.getOffset()).isEqualTo(7);
    assertThat(page.getPageSize()).isEqualTo(5);
    assertThat(page.next().getOffset()).isEqualTo(12);
    assertThat(page.previousOrFirst().getOffset()).isEqualTo(2);
    assertThat(page.first().getOffset()).isZero();
  }

  @Test
  void boundsAreEnforced() {
    assertThatThrownBy(() -> OffsetPageRequest.of(-1, 20, Sort.unsorted()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> OffsetPageRequest.of(0, 0, Sort.unsorted()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> OffsetPageRequest.of(0, 101, Sort.unsorted()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(OffsetPageRequest.of(0, 100, Sort.unsorted()).getPageSize()).isEqualTo(100);
  }
}

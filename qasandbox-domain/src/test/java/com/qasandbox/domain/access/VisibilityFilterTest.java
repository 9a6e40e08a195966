package com.qasandbox.domain.access;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VisibilityFilterTest {

  private record Row(long id, long ownerId) {}

  private final VisibilityFilter filter = new VisibilityFilter();

  private final List<Row> rows = List.of(new Row(1, 7), new Row(2, 9), new Row(3, 7), new Row(4, 11));

  @Test
  void adminAndTesterSeeEverything() {
    assertThat(filter.filterVisible(Principal.of(1L, Role.ADMIN), rows, Row::ownerId)).containsExactlyElementsOf(rows);
    assertThat(filter.filterVisible(Principal.of(2L, Role.TESTER), rows, Row::ownerId)).containsExactlyElementsOf(rows);
    assertThat(filter.ownerScope(Principal.of(1L, Role.ADMIN))).isEmpty();
    assertThat(filter.ownerScope(Principal.of(2L, Role.TESTER))).isEmpty();
  }

  @Test
  void viewerSeesOnlyOwnRowsInOrder() {
    Principal viewer = Principal.of(7L, Role.VIEWER);

    assertThat(filter.filterVisible(viewer, rows, Row::ownerId))
        .extracting(Row::id)
        .containsExactly(1L, 3L);
    assertThat(filter.ownerScope(viewer)).contains(7L);
  }

  @Test
  void listAndSingleChecksAgree() {
    Principal viewer = Principal.of(9L, Role.VIEWER);
    List<Row> visible = filter.filterVisible(viewer, rows, Row::ownerId);

    for (Row row : rows) {
      assertThat(filter.isVisible(viewer, row.ownerId())).isEqualTo(visible.contains(row));
    }
  }

  @Test
  void emptyInputGivesEmptyOutput() {
    assertThat(filter.filterVisible(Principal.of(7L, Role.VIEWER), List.<Row>of(), Row::ownerId)).isEmpty();
  }
}

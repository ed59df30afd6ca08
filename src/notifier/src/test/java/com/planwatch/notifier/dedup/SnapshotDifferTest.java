package com.planwatch.notifier.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SnapshotDifferTest {

  @Test
  void firstObservationOnlyEstablishesBaseline() {
    SnapshotDiffer differ = new SnapshotDiffer();

    assertThat(differ.diff("main", Set.of("A", "B", "C"))).isEmpty();
    assertThat(differ.hasBaseline("main")).isTrue();
  }

  @Test
  void returnsOnlyNewlyAppearedIds() {
    SnapshotDiffer differ = new SnapshotDiffer();
    differ.diff("main", Set.of("A", "B"));

    assertThat(differ.diff("main", Set.of("B", "C"))).containsExactly("C");
    // A left and comes back: it is new again relative to {B, C}.
    assertThat(differ.diff("main", Set.of("A", "B", "C"))).containsExactly("A");
  }

  @Test
  void keepsCurrentSnapshotOrder() {
    SnapshotDiffer differ = new SnapshotDiffer();
    differ.diff("main", Set.of("A"));

    Set<String> current = new LinkedHashSet<>(List.of("Z9", "A", "M4", "B2"));
    assertThat(differ.diff("main", current)).containsExactly("Z9", "M4", "B2");
  }

  @Test
  void feedIdentitiesHaveIndependentBaselines() {
    SnapshotDiffer differ = new SnapshotDiffer();
    differ.diff("main", Set.of("A"));

    assertThat(differ.diff("event", Set.of("A", "B"))).isEmpty();
    assertThat(differ.diff("main", Set.of("A", "B"))).containsExactly("B");
    assertThat(differ.hasBaseline("other")).isFalse();
  }
}

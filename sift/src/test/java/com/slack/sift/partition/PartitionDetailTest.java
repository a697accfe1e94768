package com.slack.sift.partition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.List;
import org.junit.jupiter.api.Test;

public class PartitionDetailTest {

  @Test
  public void testSeededPartitionsAreUnmeasured() {
    PartitionDetail detail =
        PartitionDetail.seeded(
            List.of(new PartitionRange(200, 300), new PartitionRange(100, 200)), 50, true, "sid");

    assertThat(detail.size()).isEqualTo(2);
    assertThat(detail.getPartitionTotal()).containsExactly(-1L, -1L);
    assertThat(detail.hasUnknownTotal()).isTrue();
    assertThat(detail.knownTotal()).isZero();
    assertThat(detail.getPage(1)).containsExactly(new PageSlice(200, 300, 0, 50, true, "sid"));
    assertThat(detail.getPage(2)).containsExactly(new PageSlice(100, 200, 0, 50, true, "sid"));
  }

  @Test
  public void testRecordTotalMeasuresFirstUnknownMatch() {
    PartitionDetail detail =
        PartitionDetail.seeded(
            List.of(new PartitionRange(200, 300), new PartitionRange(100, 200)), 50, false, null);

    assertThat(detail.recordTotal(100, 42)).isEqualTo(1);
    assertThat(detail.recordTotal(100, 7)).isEqualTo(-1);
    assertThat(detail.recordTotal(999, 7)).isEqualTo(-1);
    assertThat(detail.getPartitionTotal()).containsExactly(-1L, 42L);
    assertThat(detail.knownTotal()).isEqualTo(42);
  }

  @Test
  public void testSingleCarriesExplicitWindow() {
    PartitionDetail detail = PartitionDetail.single(10, 20, 5, 15);
    assertThat(detail.getPartitions()).containsExactly(new PartitionRange(10, 20));
    assertThat(detail.getPage(1)).containsExactly(new PageSlice(10, 20, 5, 15, false, null));

    detail.adjustSinglePartitionStart(12);
    assertThat(detail.getPartition(0)).isEqualTo(new PartitionRange(12, 20));
  }

  @Test
  public void testAdjustStartIgnoresManyPartitions() {
    PartitionDetail detail =
        PartitionDetail.seeded(
            List.of(new PartitionRange(200, 300), new PartitionRange(100, 200)), 50, false, null);
    detail.adjustSinglePartitionStart(150);
    assertThat(detail.getPartition(0)).isEqualTo(new PartitionRange(200, 300));
  }

  @Test
  public void testPageOutOfRangeIsEmpty() {
    PartitionDetail detail = PartitionDetail.single(10, 20, 0, 15);
    assertThat(detail.getPage(0)).isEmpty();
    assertThat(detail.getPage(2)).isEmpty();
  }

  @Test
  public void testMalformedPartitionIsRejected() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> PartitionPlanner.toRanges(List.of(List.of(1L, 2L, 3L))));
    assertThat(PartitionPlanner.toRanges(null)).isEmpty();
  }
}

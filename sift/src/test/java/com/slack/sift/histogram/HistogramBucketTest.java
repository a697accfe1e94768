package com.slack.sift.histogram;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

public class HistogramBucketTest {

  @Test
  public void testIncrement() {
    HistogramBucket bucket = new HistogramBucket("2024-05-01T10:00:00");
    assertThat(bucket.getCount()).isZero();
    bucket.increment(5);
    bucket.increment(3);
    assertThat(bucket.getCount()).isEqualTo(8);
    assertThat(bucket).isEqualTo(new HistogramBucket("2024-05-01T10:00:00", 8));
  }

  @Test
  public void testBucketsSortByTime() {
    List<HistogramBucket> buckets =
        new ArrayList<>(
            List.of(
                new HistogramBucket("2024-05-01T10:00:30"),
                new HistogramBucket("2024-05-01T09:59:30"),
                new HistogramBucket("2024-05-01T10:00:00")));
    Collections.sort(buckets);
    assertThat(buckets)
        .extracting(HistogramBucket::getKey)
        .containsExactly("2024-05-01T09:59:30", "2024-05-01T10:00:00", "2024-05-01T10:00:30");
  }

  @Test
  public void testInvalidBuckets() {
    assertThatIllegalArgumentException().isThrownBy(() -> new HistogramBucket(""));
    assertThatIllegalArgumentException().isThrownBy(() -> new HistogramBucket(null));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> new HistogramBucket("2024-05-01T10:00:00", -1));
  }
}

package com.slack.sift.histogram;

import com.google.common.base.Objects;

/**
 * One bar of the histogram: the time key of the bucket and the number of events counted in it. The
 * key is the bucket start formatted as {@code yyyy-MM-dd'T'HH:mm:ss} in UTC.
 */
public class HistogramBucket implements Comparable<HistogramBucket> {
  private final String key;
  private long count;

  public HistogramBucket(String key, long count) {
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("Histogram bucket key can't be empty");
    }
    if (count < 0) {
      throw new IllegalArgumentException(
          String.format("The count %s of bucket %s can't be negative", count, key));
    }
    this.key = key;
    this.count = count;
  }

  public HistogramBucket(String key) {
    this(key, 0);
  }

  public void increment(long incr) {
    this.count += incr;
  }

  public String getKey() {
    return key;
  }

  public long getCount() {
    return count;
  }

  @Override
  public int compareTo(HistogramBucket bucket) {
    return key.compareTo(bucket.key);
  }

  public String toString() {
    return String.format("HistogramBucket key:%s, count:%d", key, count);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    HistogramBucket that = (HistogramBucket) o;
    return count == that.count && key.equals(that.key);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key, count);
  }
}

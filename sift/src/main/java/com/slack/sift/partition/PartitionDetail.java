package com.slack.sift.partition;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partitions of a run with their measured totals and the logical pages built over them. A total of
 * {@link #UNKNOWN_TOTAL} marks a partition no response has measured yet.
 */
public class PartitionDetail {
  public static final long UNKNOWN_TOTAL = -1;

  private final List<PartitionRange> partitions;
  private final List<Long> partitionTotal;
  private List<List<PageSlice>> paginations;
  private final boolean streamingOutput;
  private final String streamingId;

  private PartitionDetail(
      List<PartitionRange> partitions,
      List<Long> partitionTotal,
      List<List<PageSlice>> paginations,
      boolean streamingOutput,
      String streamingId) {
    checkArgument(
        partitions.size() == partitionTotal.size(),
        "partitions and partitionTotal must have the same length");
    this.partitions = new ArrayList<>(partitions);
    this.partitionTotal = new ArrayList<>(partitionTotal);
    this.paginations = paginations;
    this.streamingOutput = streamingOutput;
    this.streamingId = streamingId;
  }

  public static PartitionDetail empty() {
    return new PartitionDetail(List.of(), List.of(), new ArrayList<>(), false, null);
  }

  /** One unmeasured page per partition, each reading the first {@code rowsPerPage} rows. */
  public static PartitionDetail seeded(
      List<PartitionRange> partitions,
      int rowsPerPage,
      boolean streamingOutput,
      String streamingId) {
    List<Long> totals = new ArrayList<>(partitions.size());
    List<List<PageSlice>> paginations = new ArrayList<>(partitions.size());
    for (PartitionRange partition : partitions) {
      totals.add(UNKNOWN_TOTAL);
      List<PageSlice> page = new ArrayList<>();
      page.add(
          new PageSlice(
              partition.startTime(),
              partition.endTime(),
              0,
              rowsPerPage,
              streamingOutput,
              streamingId));
      paginations.add(page);
    }
    return new PartitionDetail(partitions, totals, paginations, streamingOutput, streamingId);
  }

  /** The whole window as a single partition read with an explicit offset and size. */
  public static PartitionDetail single(long startTime, long endTime, int from, int size) {
    List<List<PageSlice>> paginations = new ArrayList<>();
    paginations.add(
        new ArrayList<>(List.of(new PageSlice(startTime, endTime, from, size, false, null))));
    return new PartitionDetail(
        List.of(new PartitionRange(startTime, endTime)),
        List.of(UNKNOWN_TOTAL),
        paginations,
        false,
        null);
  }

  public int size() {
    return partitions.size();
  }

  public List<PartitionRange> getPartitions() {
    return Collections.unmodifiableList(partitions);
  }

  public PartitionRange getPartition(int index) {
    return partitions.get(index);
  }

  public List<Long> getPartitionTotal() {
    return Collections.unmodifiableList(partitionTotal);
  }

  public long getTotal(int index) {
    return partitionTotal.get(index);
  }

  public void setTotal(int index, long total) {
    partitionTotal.set(index, total);
  }

  /** Sum of the measured totals; unmeasured partitions count as zero. */
  public long knownTotal() {
    long total = 0;
    for (long partitionTotal : partitionTotal) {
      total += Math.max(partitionTotal, 0);
    }
    return total;
  }

  public boolean hasUnknownTotal() {
    return partitionTotal.contains(UNKNOWN_TOTAL);
  }

  /**
   * Measures the first unmeasured partition starting at {@code startTime}.
   *
   * @return the index of the updated partition or -1
   */
  public int recordTotal(long startTime, long total) {
    for (int i = 0; i < partitions.size(); i++) {
      if (partitionTotal.get(i) == UNKNOWN_TOTAL && partitions.get(i).startTime() == startTime) {
        partitionTotal.set(i, total);
        return i;
      }
    }
    return -1;
  }

  /** Moves the start of a lone partition, used when the server narrows the searched window. */
  public void adjustSinglePartitionStart(long startTime) {
    if (partitions.size() == 1) {
      partitions.set(0, new PartitionRange(startTime, partitions.get(0).endTime()));
    }
  }

  public List<List<PageSlice>> getPaginations() {
    return Collections.unmodifiableList(paginations);
  }

  /** Slices of the 1-based logical page, empty when that page isn't materialized. */
  public List<PageSlice> getPage(int pageNumber) {
    if (pageNumber < 1 || pageNumber > paginations.size()) {
      return List.of();
    }
    return Collections.unmodifiableList(paginations.get(pageNumber - 1));
  }

  void setPaginations(List<List<PageSlice>> paginations) {
    this.paginations = paginations;
  }

  public boolean isStreamingOutput() {
    return streamingOutput;
  }

  public String getStreamingId() {
    return streamingId;
  }

  @Override
  public String toString() {
    return "PartitionDetail{"
        + "partitions="
        + partitions
        + ", partitionTotal="
        + partitionTotal
        + ", paginations="
        + paginations
        + '}';
  }
}

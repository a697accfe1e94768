package com.slack.sift.partition;

/** A server chosen time sub-range of the searched window, in microseconds. */
public record PartitionRange(long startTime, long endTime) {}

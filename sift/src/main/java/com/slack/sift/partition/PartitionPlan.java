package com.slack.sift.partition;

/**
 * Partitions of a run plus what the partition call said about the query.
 *
 * @param histogramEligible null when the server didn't say
 * @param histogramInterval bucket width in seconds, null when the server didn't pick one
 * @param records row count reported for multi-stream requests
 */
public record PartitionPlan(
    PartitionDetail detail, Boolean histogramEligible, Long histogramInterval, long records) {}

package com.slack.sift.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The part of the window a streamed search has covered so far. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeOffset(
    @JsonProperty("start_time") long startTime, @JsonProperty("end_time") long endTime) {}

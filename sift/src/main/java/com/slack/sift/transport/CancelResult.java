package com.slack.sift.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CancelResult(
    @JsonProperty("trace_id") String traceId, @JsonProperty("is_success") boolean success) {}

package com.slack.sift.transport;

import brave.Tracing;
import brave.propagation.TraceContext;

/** Mints a new root trace for every remote call. */
public class TraceContextFactory {
  private final Tracing tracing;

  public TraceContextFactory(Tracing tracing) {
    this.tracing = tracing;
  }

  public static TraceContextFactory create() {
    return new TraceContextFactory(
        Tracing.newBuilder().localServiceName("sift").traceId128Bit(true).build());
  }

  public SearchTrace newTrace() {
    TraceContext context = tracing.tracer().newTrace().context();
    return new SearchTrace(context.traceIdString(), context.spanIdString());
  }
}

package com.slack.sift.testlib;

import com.slack.sift.transport.CommunicationMethod;
import com.slack.sift.transport.SearchCall;
import com.slack.sift.transport.SearchResponse;
import com.slack.sift.transport.SearchTransport;
import com.slack.sift.transport.SearchType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** Answers searches from a function and records every call it receives. */
public class FakeSearchTransport implements SearchTransport {
  private final CommunicationMethod method;
  private final Function<SearchCall, SearchResponse> responder;
  private final List<SearchCall> calls = new CopyOnWriteArrayList<>();
  private final List<Collection<String>> cancels = new CopyOnWriteArrayList<>();
  private volatile boolean cancelResult = true;

  public FakeSearchTransport(
      CommunicationMethod method, Function<SearchCall, SearchResponse> responder) {
    this.method = method;
    this.responder = responder;
  }

  public FakeSearchTransport(Function<SearchCall, SearchResponse> responder) {
    this(CommunicationMethod.HTTP, responder);
  }

  @Override
  public CommunicationMethod method() {
    return method;
  }

  @Override
  public CompletableFuture<SearchResponse> search(SearchCall call) {
    calls.add(call);
    try {
      return CompletableFuture.completedFuture(responder.apply(call));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public CompletableFuture<Boolean> cancel(String orgId, Collection<String> traceIds) {
    cancels.add(new ArrayList<>(traceIds));
    return CompletableFuture.completedFuture(cancelResult);
  }

  public void setCancelResult(boolean cancelResult) {
    this.cancelResult = cancelResult;
  }

  public List<SearchCall> getCalls() {
    return new ArrayList<>(calls);
  }

  public List<SearchCall> getCalls(SearchType type) {
    return calls.stream().filter(call -> call.type() == type).toList();
  }

  public List<Collection<String>> getCancels() {
    return new ArrayList<>(cancels);
  }
}

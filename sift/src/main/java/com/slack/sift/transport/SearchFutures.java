package com.slack.sift.transport;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Blocking waits on transport futures that surface failures as {@link SearchException}s. */
public class SearchFutures {
  private SearchFutures() {}

  public static <T> T await(CompletableFuture<T> future, Duration timeout, String traceId) {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SearchException || cause instanceof SearchCancelledException) {
        throw (RuntimeException) cause;
      }
      throw new SearchException(
          cause == null ? e.getMessage() : cause.getMessage(), traceId, cause);
    } catch (TimeoutException e) {
      future.cancel(false);
      throw new SearchException(
          "Request timed out after " + timeout.toMillis() + " ms", traceId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchException("Interrupted while waiting for a response", traceId, e);
    }
  }
}

package com.qasandbox.api.tracing;

/**
 * Per-request correlation id stored in a ThreadLocal, read by audit logging.
 */
public final class RequestContext {

  private static final ThreadLocal<String> TL = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    TL.set(requestId);
  }

  public static void clear() {
    TL.remove();
  }

  public static String requestId() {
    return TL.get();
  }
}

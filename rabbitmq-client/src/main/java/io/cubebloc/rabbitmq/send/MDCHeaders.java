package io.cubebloc.rabbitmq.send;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.MDC;

/**
 * Puts everything from MDC context to message headers, keys are prefixed with {@value #MDC_PREFIX}.
 */
public final class MDCHeaders {

  public static final String MDC_PREFIX = "_MDC_";

  private MDCHeaders() {
  }

  /**
   * @return {@code headers} untouched if MDC context is empty, otherwise a copy with MDC entries added
   */
  @Nullable
  public static Map<String, Object> withContext(@Nullable Map<String, Object> headers) {
    Map<String, String> mdcContext = MDC.getCopyOfContextMap();
    if (mdcContext == null || mdcContext.isEmpty()) {
      return headers;
    }
    Map<String, Object> merged = headers == null ? new HashMap<>() : new HashMap<>(headers);
    for (Map.Entry<String, String> entry : mdcContext.entrySet()) {
      merged.put(MDC_PREFIX + entry.getKey(), entry.getValue());
    }
    return merged;
  }
}

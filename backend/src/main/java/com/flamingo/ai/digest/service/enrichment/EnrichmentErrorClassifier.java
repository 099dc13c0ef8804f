package com.flamingo.ai.digest.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.flamingo.ai.digest.exception.EnrichmentErrorKind;
import com.flamingo.ai.digest.exception.EnrichmentException;
import dev.langchain4j.exception.HttpException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import org.springframework.stereotype.Component;

/** Maps provider failures onto {@link EnrichmentErrorKind}. */
@Component
public class EnrichmentErrorClassifier {

  private static final int MAX_CAUSE_DEPTH = 20;

  public EnrichmentErrorKind classify(Throwable error) {
    List<Throwable> chain = causeChain(error);

    for (Throwable t : chain) {
      if (t instanceof EnrichmentException enrichment) {
        return enrichment.getKind();
      }
    }

    for (Throwable t : chain) {
      if (t instanceof HttpException http) {
        int status = http.statusCode();
        if (status == 429) {
          return EnrichmentErrorKind.RATE_LIMITED;
        }
        if (status == 408 || status >= 500) {
          return EnrichmentErrorKind.TRANSIENT;
        }
        if (status >= 400) {
          return EnrichmentErrorKind.PERMANENT;
        }
      }
    }

    for (Throwable t : chain) {
      if (t instanceof TimeoutException) {
        return EnrichmentErrorKind.TRANSIENT;
      }
      if (t instanceof JsonProcessingException) {
        return EnrichmentErrorKind.PERMANENT;
      }
    }

    String messages = joinedMessages(chain);
    if (messages.contains("rate") && messages.contains("limit")) {
      return EnrichmentErrorKind.RATE_LIMITED;
    }
    if (messages.contains("timed out") || messages.contains("timeout")) {
      return EnrichmentErrorKind.TRANSIENT;
    }
    for (Throwable t : chain) {
      if (t instanceof IOException) {
        return EnrichmentErrorKind.TRANSIENT;
      }
    }
    // Unknown failures are retried; the retry budget bounds them.
    return EnrichmentErrorKind.TRANSIENT;
  }

  public EnrichmentException toException(Throwable error) {
    if (error instanceof EnrichmentException enrichment) {
      return enrichment;
    }
    EnrichmentErrorKind kind = classify(error);
    String message = error == null || error.getMessage() == null ? kind.name() : error.getMessage();
    return new EnrichmentException(kind, message, error);
  }

  private static List<Throwable> causeChain(Throwable error) {
    List<Throwable> chain = new ArrayList<>();
    Throwable current = error;
    while (current != null && chain.size() < MAX_CAUSE_DEPTH) {
      chain.add(current);
      Throwable next = current.getCause();
      if (next == current) {
        break;
      }
      current = next;
    }
    return chain;
  }

  private static String joinedMessages(List<Throwable> chain) {
    StringBuilder sb = new StringBuilder();
    for (Throwable t : chain) {
      if (t.getMessage() != null) {
        sb.append(t.getMessage().toLowerCase(Locale.ROOT)).append(" | ");
      }
    }
    return sb.toString();
  }
}

package dev.brainlift.generation;

import dev.brainlift.research.PermanentJobException;
import dev.brainlift.research.QuotaExceededException;
import dev.brainlift.research.ResearchException;
import dev.brainlift.research.TransientServiceException;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider exceptions onto the research error taxonomy by inspecting the cause chain and the
 * error message.
 */
final class GenerationErrors {

  private static final List<String> QUOTA_MARKERS =
      List.of("insufficient_quota", "exceeded your current quota", "billing");

  private static final List<String> TRANSIENT_MARKERS =
      List.of(
          "network", "timeout", "timed out", "rate limit", "429", "500", "502", "503",
          "overloaded", "connection");

  private GenerationErrors() {}

  static ResearchException classify(RuntimeException e) {
    if (e instanceof ResearchException research) {
      return research;
    }
    String message = describe(e);
    String lower = message.toLowerCase(Locale.ROOT);
    if (QUOTA_MARKERS.stream().anyMatch(lower::contains)) {
      return new QuotaExceededException("Generation quota exceeded: " + message);
    }
    if (hasIoCause(e) || TRANSIENT_MARKERS.stream().anyMatch(lower::contains)) {
      return new TransientServiceException("Generation failed transiently: " + message, e);
    }
    return new PermanentJobException("Generation failed: " + message, e);
  }

  private static boolean hasIoCause(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof IOException || t instanceof TimeoutException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  private static String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}

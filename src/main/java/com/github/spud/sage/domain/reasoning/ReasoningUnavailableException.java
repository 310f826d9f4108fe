package com.github.spud.sage.domain.reasoning;

/**
 * Raised on first use when the generative model is not configured; callers fall back to the
 * rules-only path.
 */
public class ReasoningUnavailableException extends RuntimeException {

  public ReasoningUnavailableException(String message) {
    super(message);
  }

  public ReasoningUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.github.themoah.pegdiff.api;

/**
 * Thrown when a comparison request body cannot be turned into engine input.
 */
public class ComparisonRequestException extends RuntimeException {

  public ComparisonRequestException(String message) {
    super(message);
  }

  public ComparisonRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.github.themoah.pegdiff.stats;

/**
 * Raised when a hypothesis test gets fewer observations than it needs.
 */
public class InsufficientDataException extends Exception {

  public InsufficientDataException(String message) {
    super(message);
  }
}

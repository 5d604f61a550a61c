package io.github.themoah.pegdiff.config;

/**
 * Thrown when a comparison threshold or paging parameter is out of its valid range.
 * Raised before any computation starts.
 */
public class InvalidConfigException extends RuntimeException {

  public InvalidConfigException(String message) {
    super(message);
  }
}

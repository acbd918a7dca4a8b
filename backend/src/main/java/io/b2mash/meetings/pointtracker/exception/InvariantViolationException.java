package io.b2mash.meetings.pointtracker.exception;

/**
 * Internal consistency failure, e.g. a permission action with no entry in the effective matrix.
 * Never a caller error; surfaces as a 500.
 */
public class InvariantViolationException extends RuntimeException {

  public InvariantViolationException(String message) {
    super(message);
  }
}

package com.quantori.mge.api;

import com.quantori.mge.api.model.core.NotationError;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Thrown when a caller asks for the result of a notation that was rejected.
 */
@Getter
public class NotationException extends RuntimeException {
  private final List<NotationError> errors;

  /**
   * Constructs a {@code NotationException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public NotationException(String message) {
    super(message);
    this.errors = List.of();
  }

  /**
   * Constructs a {@code NotationException} listing the errors that rejected the input.
   *
   * @param errors errors with their positions
   */
  public NotationException(List<NotationError> errors) {
    super(errors.stream().map(NotationError::toString).collect(Collectors.joining("; ")));
    this.errors = List.copyOf(errors);
  }

  /**
   * Constructs a {@code NotationException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public NotationException(String message, Throwable cause) {
    super(message, cause);
    this.errors = List.of();
  }
}

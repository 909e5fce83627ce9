package com.quantori.mge.core.notation;

import lombok.Getter;

/**
 * Raised inside the readers to abort a fragment; converted to a positional error by the caller.
 */
@Getter
class NotationSyntaxException extends RuntimeException {
  private final int position;

  NotationSyntaxException(int position, String message) {
    super(message);
    this.position = position;
  }

  NotationSyntaxException(int position, String message, Throwable cause) {
    super(message, cause);
    this.position = position;
  }
}

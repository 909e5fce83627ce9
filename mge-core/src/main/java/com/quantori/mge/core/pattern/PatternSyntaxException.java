package com.quantori.mge.core.pattern;

import lombok.Getter;

@Getter
class PatternSyntaxException extends RuntimeException {
  private final int position;

  PatternSyntaxException(int position, String message) {
    super(message);
    this.position = position;
  }

  PatternSyntaxException(int position, String message, Throwable cause) {
    super(message, cause);
    this.position = position;
  }
}

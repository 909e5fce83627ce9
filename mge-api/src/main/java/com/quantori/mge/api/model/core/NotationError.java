package com.quantori.mge.api.model.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class NotationError {
  private ErrorType type;
  /**
   * Zero based offset in the input text, -1 when the problem has no single position
   */
  private int position;
  private String message;

  @Override
  public String toString() {
    return position >= 0
        ? String.format("%s at %d: %s", type, position, message)
        : String.format("%s: %s", type, message);
  }
}

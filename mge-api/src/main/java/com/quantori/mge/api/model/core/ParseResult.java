package com.quantori.mge.api.model.core;

import com.quantori.mge.api.NotationException;
import com.quantori.mge.api.model.Molecule;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Outcome of parsing a molecule notation: either molecules or errors, never both.
 */
@Getter
@Builder
public class ParseResult {
  /**
   * One molecule per fragment; empty when {@link #getErrors()} is not empty.
   */
  @Singular
  private final List<Molecule> molecules;
  @Singular
  private final List<NotationError> errors;
  /**
   * Valence and aromaticity problems that did not reject the input
   */
  @Singular
  private final List<NotationError> warnings;

  public boolean isSuccess() {
    return errors.isEmpty();
  }

  /**
   * Returns the parsed molecules or throws when the input was rejected.
   *
   * @return parsed molecules
   * @throws NotationException carrying the errors
   */
  public List<Molecule> getMoleculesOrThrow() {
    if (!isSuccess()) {
      throw new NotationException(errors);
    }
    return molecules;
  }
}

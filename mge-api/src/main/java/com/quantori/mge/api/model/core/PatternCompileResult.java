package com.quantori.mge.api.model.core;

import com.quantori.mge.api.NotationException;
import com.quantori.mge.api.model.pattern.Pattern;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

@Getter
@Builder
public class PatternCompileResult {
  private final Pattern pattern;
  @Singular
  private final List<NotationError> errors;

  public boolean isSuccess() {
    return errors.isEmpty() && pattern != null;
  }

  public Optional<Pattern> pattern() {
    return Optional.ofNullable(pattern);
  }

  public Pattern getPatternOrThrow() {
    if (!isSuccess()) {
      throw new NotationException(errors);
    }
    return pattern;
  }
}

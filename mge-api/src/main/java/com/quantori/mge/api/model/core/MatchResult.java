package com.quantori.mge.api.model.core;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@Builder
public class MatchResult {
  private final List<Match> matches;
  private final SearchStatus status;
  /**
   * Candidate expansions performed by the search
   */
  private final long steps;

  public static MatchResult empty() {
    return MatchResult.builder().matches(List.of()).status(SearchStatus.COMPLETE).build();
  }

  public boolean isMatched() {
    return !matches.isEmpty();
  }

  /**
   * @return {@code true} when the search stopped on a bound rather than exhausting candidates
   */
  public boolean isTruncated() {
    return status != SearchStatus.COMPLETE;
  }
}

package com.quantori.mge.api.model.core;

/**
 * How a substructure search ended.
 */
public enum SearchStatus {
  /**
   * Every candidate mapping was explored
   */
  COMPLETE,
  /**
   * Stopped after collecting {@link MatchOptions#getMaxMatches()} matches
   */
  MATCH_LIMIT_REACHED,
  /**
   * Stopped by {@link MatchOptions#getMaxSearchSteps()} or {@link MatchOptions#getMaxSearchDepth()}
   */
  SEARCH_LIMIT_REACHED
}

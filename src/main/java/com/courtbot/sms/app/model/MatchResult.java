package com.courtbot.sms.app.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** Outcome of matching one inbound text against the citation store. */
@Getter
@ToString
@AllArgsConstructor
public class MatchResult {

  public enum Outcome {
    /** Exactly one case carries the citation. */
    UNIQUE,
    /** No unique case, but the text looks like a citation; eligible for queueing. */
    PLAUSIBLE_UNFOUND,
    /** No unique case and the text is outside the citation length bounds. */
    MALFORMED
  }

  private final Outcome outcome;

  /** Trimmed, upper-cased input. */
  private final String queryText;

  /** Set only for {@link Outcome#UNIQUE}. */
  private final CaseRecord match;

  public static MatchResult unique(String queryText, CaseRecord match) {
    return new MatchResult(Outcome.UNIQUE, queryText, match);
  }

  public static MatchResult plausibleUnfound(String queryText) {
    return new MatchResult(Outcome.PLAUSIBLE_UNFOUND, queryText, null);
  }

  public static MatchResult malformed(String queryText) {
    return new MatchResult(Outcome.MALFORMED, queryText, null);
  }
}

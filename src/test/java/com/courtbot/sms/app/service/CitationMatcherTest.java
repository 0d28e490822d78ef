package com.courtbot.sms.app.service;

import static org.junit.jupiter.api.Assertions.*;

import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.MatchResult;
import com.courtbot.sms.app.model.MatchResult.Outcome;
import com.courtbot.sms.app.support.InMemoryCitationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CitationMatcherTest {

  private InMemoryCitationStore store;
  private CitationMatcher matcher;

  @BeforeEach
  void setUp() {
    store = new InMemoryCitationStore();
    matcher = new CitationMatcher(store, 6, 25);
  }

  @Test
  void shortCitationStillMatchesWhenUnique() {
    store.add(CaseRecord.builder().id("1").citation("Z-9").defendant("A").build());

    MatchResult r = matcher.match(" z-9 ");

    assertEquals(Outcome.UNIQUE, r.getOutcome());
    assertEquals("Z-9", r.getQueryText());
    assertEquals("1", r.getMatch().getId());
  }

  @Test
  void lengthBoundsAreInclusive() {
    assertEquals(Outcome.MALFORMED, matcher.match("ABCDE").getOutcome());
    assertEquals(Outcome.PLAUSIBLE_UNFOUND, matcher.match("ABCDEF").getOutcome());
    assertEquals(Outcome.PLAUSIBLE_UNFOUND, matcher.match("A".repeat(25)).getOutcome());
    assertEquals(Outcome.MALFORMED, matcher.match("A".repeat(26)).getOutcome());
  }

  @Test
  void blankInputIsMalformedWithoutQueryingStore() {
    store.setFailing(true);

    assertEquals(Outcome.MALFORMED, matcher.match("   ").getOutcome());
    assertEquals(Outcome.MALFORMED, matcher.match(null).getOutcome());
  }

  @Test
  void multipleHitsAreNotUnique() {
    store.add(CaseRecord.builder().id("1").citation("TWIN0001").defendant("A").build());
    store.add(CaseRecord.builder().id("2").citation("TWIN0001").defendant("B").build());

    MatchResult r = matcher.match("twin0001");

    assertEquals(Outcome.PLAUSIBLE_UNFOUND, r.getOutcome());
    assertNull(r.getMatch());
    assertTrue(matcher.uniqueMatch("TWIN0001").isEmpty());
  }
}

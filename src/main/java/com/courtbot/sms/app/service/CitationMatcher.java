package com.courtbot.sms.app.service;

import com.courtbot.sms.app.config.CourtbotProperties;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.MatchResult;
import com.courtbot.sms.app.repository.CitationStore;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Turns inbound text into a match outcome. Reads the citation store only; never writes.
 *
 * <p>More than one exact hit is reported the same as none: a citation number alone cannot
 * disambiguate, and the sender is not told which case applied.
 */
@Log4j2
public class CitationMatcher {

  private final CitationStore citationStore;
  private final int minLength;
  private final int maxLength;

  public CitationMatcher(CitationStore citationStore, CourtbotProperties props) {
    this(citationStore, props.getCitationMinLength(), props.getCitationMaxLength());
  }

  public CitationMatcher(CitationStore citationStore, int minLength, int maxLength) {
    this.citationStore = citationStore;
    this.minLength = minLength;
    this.maxLength = maxLength;
  }

  public static String normalize(String raw) {
    return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
  }

  public MatchResult match(String raw) {
    String queryText = normalize(raw);
    Optional<CaseRecord> unique = uniqueMatch(queryText);
    if (unique.isPresent()) {
      return MatchResult.unique(queryText, unique.get());
    }
    int len = queryText.length();
    if (len >= minLength && len <= maxLength) {
      return MatchResult.plausibleUnfound(queryText);
    }
    return MatchResult.malformed(queryText);
  }

  /** The single case carrying this citation, if exactly one does. */
  public Optional<CaseRecord> uniqueMatch(String citationText) {
    String queryText = normalize(citationText);
    if (queryText.isEmpty()) return Optional.empty();
    List<CaseRecord> hits = citationStore.findExact(queryText);
    if (hits.size() > 1) {
      log.info("matcher.ambiguous citation={} hits={}", queryText, hits.size());
    }
    return hits.size() == 1 ? Optional.of(hits.get(0)) : Optional.empty();
  }
}

package com.courtbot.sms.app.service;

import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.CaseSearchResult;
import com.courtbot.sms.app.repository.CitationStore;
import com.courtbot.sms.app.util.CourtTextFormatter;
import java.util.List;
import java.util.stream.Collectors;

/** Name-or-citation search for the web lookup page. Not part of the SMS dialogue. */
public class CaseSearchService {

  private final CitationStore citationStore;

  public CaseSearchService(CitationStore citationStore) {
    this.citationStore = citationStore;
  }

  public List<CaseSearchResult> search(String query) {
    return citationStore.findFuzzy(query).stream()
        .map(CaseSearchService::toResult)
        .collect(Collectors.toList());
  }

  private static CaseSearchResult toResult(CaseRecord c) {
    return CaseSearchResult.builder()
        .id(c.getId())
        .citation(c.getCitation())
        .defendant(c.getDefendant())
        .date(c.getDate())
        .time(c.getTime())
        .room(c.getRoom())
        .courtType(c.getCourtType())
        .readableDate(CourtTextFormatter.readableDate(c.getDate()))
        .build();
  }
}

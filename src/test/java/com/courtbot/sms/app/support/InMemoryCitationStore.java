package com.courtbot.sms.app.support;

import com.courtbot.sms.app.exception.StoreUnavailableException;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.repository.CitationStore;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryCitationStore implements CitationStore {

  private final List<CaseRecord> cases = new CopyOnWriteArrayList<>();
  private volatile boolean failing;

  public void add(CaseRecord c) {
    cases.add(c);
  }

  public void setFailing(boolean failing) {
    this.failing = failing;
  }

  @Override
  public List<CaseRecord> findExact(String citationText) {
    if (failing) throw new StoreUnavailableException("citation store down");
    return cases.stream()
        .filter(c -> c.getCitation().equals(citationText))
        .collect(Collectors.toList());
  }

  @Override
  public List<CaseRecord> findFuzzy(String queryText) {
    if (failing) throw new StoreUnavailableException("citation store down");
    String q = queryText.toUpperCase(Locale.ROOT);
    return cases.stream()
        .filter(
            c ->
                c.getCitation().equals(q)
                    || c.getDefendant().toUpperCase(Locale.ROOT).contains(q))
        .collect(Collectors.toList());
  }
}

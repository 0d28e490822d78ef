package com.courtbot.sms.app.repository;

import com.courtbot.sms.app.model.CaseRecord;
import java.util.List;

/** Read-only access to ingested court cases. */
public interface CitationStore {

  /** Cases whose citation number equals {@code citationText} exactly. */
  List<CaseRecord> findExact(String citationText);

  /** Cases whose defendant name partially matches, or whose citation equals, the query. */
  List<CaseRecord> findFuzzy(String queryText);
}

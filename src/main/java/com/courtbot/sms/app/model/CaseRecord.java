package com.courtbot.sms.app.model;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scheduled court case as held by the citation store.
 *
 * <p>Records are written by an external ingestion process and are read-only here. Whenever a case
 * is kept beyond a single lookup (conversation state, reminders, queue rows) a snapshot copy is
 * stored, never a live reference, because court schedules change.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CaseRecord {

  private String id;

  /** Citation number the case is referenced by. */
  private String citation;

  private String defendant;

  private LocalDate date;

  /** Clock time as ingested, e.g. {@code 14:30} or {@code 14:30:00}. */
  private String time;

  private String room;

  /** district | superior. */
  private String courtType;

  /** Detached copy used for snapshots. */
  public CaseRecord snapshot() {
    return toBuilder().build();
  }
}

package com.courtbot.sms.app.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/** Fuzzy-search hit returned by {@code GET /cases}, with a server-rendered date. */
@Data
@Builder
public class CaseSearchResult {
  private String id;
  private String citation;
  private String defendant;
  private LocalDate date;
  private String time;
  private String room;
  private String courtType;
  private String readableDate;
}

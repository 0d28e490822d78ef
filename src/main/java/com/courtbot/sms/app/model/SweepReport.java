package com.courtbot.sms.app.model;

import lombok.Builder;
import lombok.Data;

/** Counters for one queue sweep run. */
@Data
@Builder
public class SweepReport {
  private int checked;
  private int found;
  private int expired;
  private int pending;
  private int failed;
}

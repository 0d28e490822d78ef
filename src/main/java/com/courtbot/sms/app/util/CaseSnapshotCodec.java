package com.courtbot.sms.app.util;

import com.courtbot.sms.app.exception.StoreUnavailableException;
import com.courtbot.sms.app.model.CaseRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of case snapshots kept in queue rows, reminders and conversation state. Unreadable
 * snapshots surface as {@link StoreUnavailableException}, like any other store fault.
 */
public class CaseSnapshotCodec {

  private final ObjectMapper mapper;

  public CaseSnapshotCodec() {
    this(new ObjectMapper());
  }

  public CaseSnapshotCodec(ObjectMapper base) {
    this.mapper =
        base.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String toJson(CaseRecord record) {
    if (record == null) return null;
    try {
      return mapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new StoreUnavailableException(
          "Failed to serialize case snapshot id=" + record.getId(), e);
    }
  }

  public CaseRecord fromJson(String json) {
    if (json == null || json.isBlank()) return null;
    try {
      return mapper.readValue(json, CaseRecord.class);
    } catch (JsonProcessingException e) {
      throw new StoreUnavailableException("Stored case snapshot is unreadable", e);
    }
  }
}

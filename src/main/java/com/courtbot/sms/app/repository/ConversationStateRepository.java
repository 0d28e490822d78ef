package com.courtbot.sms.app.repository;

import com.courtbot.sms.app.model.ConversationState;
import java.util.Optional;

/** Per-sender dialogue state keyed by phone number. */
public interface ConversationStateRepository {

  Optional<ConversationState> find(String phone);

  /** Upsert. Persistent implementations reject a write whose version is stale. */
  ConversationState save(ConversationState state);
}

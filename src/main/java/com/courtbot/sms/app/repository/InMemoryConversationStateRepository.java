package com.courtbot.sms.app.repository;

import com.courtbot.sms.app.model.ConversationState;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide state map. Lost on restart; open queue and sweep offers are then rebuilt from the
 * subscription store by the dialogue service.
 */
public class InMemoryConversationStateRepository implements ConversationStateRepository {

  private final Map<String, ConversationState> states = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryConversationStateRepository(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<ConversationState> find(String phone) {
    ConversationState s = states.get(phone);
    return s == null ? Optional.empty() : Optional.of(s.toBuilder().build());
  }

  @Override
  public ConversationState save(ConversationState state) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(state.getPhone(), "state.phone");
    long next = state.getVersion() == null ? 1L : state.getVersion() + 1;
    ConversationState stored =
        state.toBuilder()
            .matchedCase(state.getMatchedCase() == null ? null : state.getMatchedCase().snapshot())
            .version(next)
            .updatedAt(clock.instant())
            .build();
    states.put(stored.getPhone(), stored);
    return stored.toBuilder().build();
  }
}

package com.courtbot.sms.app.model;

import java.util.List;
import lombok.Value;

/** Outbound text segments produced for one inbound message, in send order. May be empty. */
@Value
public class DialogueReply {

  List<String> messages;

  public static DialogueReply none() {
    return new DialogueReply(List.of());
  }

  public static DialogueReply of(String... messages) {
    return new DialogueReply(List.of(messages));
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }
}

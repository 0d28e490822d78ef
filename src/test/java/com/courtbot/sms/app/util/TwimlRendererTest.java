package com.courtbot.sms.app.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TwimlRendererTest {

  @Test
  void noMessagesGivesEmptyResponse() {
    assertEquals(
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response></Response>",
        TwimlRenderer.render(List.of()));
  }

  @Test
  void eachMessageIsEscapedInOrder() {
    String xml = TwimlRenderer.render(List.of("first", "a < b & \"c\""));

    assertEquals(
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response>"
            + "<Message>first</Message>"
            + "<Message>a &lt; b &amp; &quot;c&quot;</Message>"
            + "</Response>",
        xml);
  }
}

package com.courtbot.sms.app.util;

import java.util.List;
import org.springframework.web.util.HtmlUtils;

/** Builds the TwiML document returned to the SMS webhook. */
public final class TwimlRenderer {

  private static final String XML_DECL = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

  private TwimlRenderer() {}

  public static String render(List<String> messages) {
    if (messages == null || messages.isEmpty()) {
      return XML_DECL + "<Response></Response>";
    }
    StringBuilder sb = new StringBuilder(XML_DECL).append("<Response>");
    for (String m : messages) {
      sb.append("<Message>").append(HtmlUtils.htmlEscape(m, "UTF-8")).append("</Message>");
    }
    return sb.append("</Response>").toString();
  }
}

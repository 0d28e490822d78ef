package com.courtbot.sms.app.service;

import com.courtbot.sms.app.config.CourtbotProperties;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.util.CourtTextFormatter;

/** User-facing texts. Kept in one place so the dialogue and the sweep read the same wording. */
public class ReplyTemplates {

  private final CourtbotProperties props;

  public ReplyTemplates(CourtbotProperties props) {
    this.props = props;
  }

  public String caseFound(CaseRecord c) {
    return "Found a case for "
        + CourtTextFormatter.titleCaseName(c.getDefendant())
        + " scheduled on "
        + CourtTextFormatter.shortDate(c.getDate())
        + " at "
        + CourtTextFormatter.clockTime(c.getTime())
        + ", at "
        + c.getRoom()
        + ". Would you like a courtesy reminder the day before? (reply YES or NO)";
  }

  public String[] caseNotFound() {
    return new String[] {
      "(1/2) Could not find a case with that number. It can take several days for a case to appear"
          + " in our system.",
      "(2/2) Would you like us to keep checking for the next "
          + props.getQueueTtlDays()
          + " days and text you if we find it? (reply YES or NO)"
    };
  }

  public String malformedCitation() {
    return "Couldn't find your case. Case identifier should be "
        + props.getCitationMinLength()
        + " to "
        + props.getCitationMaxLength()
        + " numbers and/or letters in length.";
  }

  public String[] reminderConfirmed() {
    return new String[] {
      "(1/2) Sounds good. We will attempt to text you a courtesy reminder the day before your case."
          + " Note that case schedules frequently change.",
      "(2/2) You should always confirm your case date and time by going to "
          + props.getCourtPublicUrl()
    };
  }

  public String queueConfirmed() {
    return "OK. We will keep checking for up to "
        + props.getQueueTtlDays()
        + " days. You can always go to "
        + props.getCourtPublicUrl()
        + " for more information about your case and contact information.";
  }

  public String optedOut() {
    return "OK. You can always go to "
        + props.getCourtPublicUrl()
        + " for more information about your case and contact information.";
  }

  public String apology() {
    return "Sorry, we are having trouble looking that up right now. Please try again in a few"
        + " minutes.";
  }

  public String queuedCaseFound(CaseRecord c) {
    return "Hello from Courtbot. We found a case for "
        + CourtTextFormatter.titleCaseName(c.getDefendant())
        + " scheduled on "
        + CourtTextFormatter.shortDate(c.getDate())
        + " at "
        + CourtTextFormatter.clockTime(c.getTime())
        + ", at "
        + c.getRoom()
        + ". Would you like a courtesy reminder the day before? (reply YES or NO)";
  }

  public String queueExpired(String citationText) {
    return "We haven't been able to find your court case "
        + citationText
        + ". You can go to "
        + props.getCourtPublicUrl()
        + " for more information.";
  }
}

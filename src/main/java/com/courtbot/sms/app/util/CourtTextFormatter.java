package com.courtbot.sms.app.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Renders case fields the way they appear in outbound texts. */
public final class CourtTextFormatter {

  private static final Pattern WORD = Pattern.compile("\\w\\S*");

  /** Scheduled times are placed on this date before formatting; only the clock time matters. */
  private static final LocalDate REFERENCE_DATE = LocalDate.of(1980, 1, 1);

  private static final DateTimeFormatter SHORT_DATE =
      DateTimeFormatter.ofPattern("EEE, MMM ", Locale.US);
  private static final DateTimeFormatter LONG_DATE =
      DateTimeFormatter.ofPattern("EEEE, MMM ", Locale.US);
  private static final DateTimeFormatter CLOCK_TIME =
      DateTimeFormatter.ofPattern("h:mm a", Locale.US);

  private CourtTextFormatter() {}

  /** "JOHN q PUBLIC" -> "John Q Public". */
  public static String titleCaseName(String name) {
    if (name == null) return "";
    Matcher m = WORD.matcher(name.trim());
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String w = m.group();
      m.appendReplacement(
          sb,
          Matcher.quoteReplacement(
              w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1).toLowerCase(Locale.ROOT)));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  /** 2024-03-04 -> "Mon, Mar 4th". */
  public static String shortDate(LocalDate date) {
    if (date == null) return "";
    return SHORT_DATE.format(date) + ordinal(date.getDayOfMonth());
  }

  /** 2024-03-04 -> "Monday, Mar 4th". */
  public static String readableDate(LocalDate date) {
    if (date == null) return "";
    return LONG_DATE.format(date) + ordinal(date.getDayOfMonth());
  }

  /** "14:30" -> "2:30 PM". Unparseable input is returned as given. */
  public static String clockTime(String time) {
    if (time == null || time.isBlank()) return "";
    try {
      LocalTime t = LocalTime.parse(time.trim());
      return CLOCK_TIME.format(LocalDateTime.of(REFERENCE_DATE, t));
    } catch (DateTimeParseException e) {
      return time.trim();
    }
  }

  static String ordinal(int day) {
    int mod100 = day % 100;
    if (mod100 >= 11 && mod100 <= 13) return day + "th";
    switch (day % 10) {
      case 1:
        return day + "st";
      case 2:
        return day + "nd";
      case 3:
        return day + "rd";
      default:
        return day + "th";
    }
  }
}

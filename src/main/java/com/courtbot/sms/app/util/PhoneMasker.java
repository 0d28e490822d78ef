package com.courtbot.sms.app.util;

/** Keeps phone numbers out of logs except for the last four digits. */
public final class PhoneMasker {

  private PhoneMasker() {}

  public static String mask(String phone) {
    if (phone == null) return "null";
    String p = phone.trim();
    if (p.length() <= 4) return "****";
    return "***" + p.substring(p.length() - 4);
  }
}

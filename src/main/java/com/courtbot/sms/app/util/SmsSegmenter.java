package com.courtbot.sms.app.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a text into numbered parts, "(1/3) ...", each no longer than the transport limit. Texts
 * that already fit are returned unchanged.
 */
public class SmsSegmenter {

  private final int limit;

  public SmsSegmenter(int limit) {
    if (limit < 20) {
      throw new IllegalArgumentException("segment limit too small: " + limit);
    }
    this.limit = limit;
  }

  public List<String> split(String text) {
    if (text == null || text.isEmpty()) return List.of();
    if (text.length() <= limit) return List.of(text);

    // Prefix width depends on the part count, so grow the estimate until it is stable.
    int parts = 2;
    List<String> chunks;
    while (true) {
      int prefix = prefix(parts, parts).length();
      chunks = chunk(text, limit - prefix);
      if (chunks.size() <= parts) break;
      parts = chunks.size();
    }
    List<String> out = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      out.add(prefix(i + 1, chunks.size()) + chunks.get(i));
    }
    return out;
  }

  private static String prefix(int i, int n) {
    return "(" + i + "/" + n + ") ";
  }

  private static List<String> chunk(String text, int width) {
    List<String> chunks = new ArrayList<>();
    String rest = text.trim();
    while (rest.length() > width) {
      int cut = rest.lastIndexOf(' ', width);
      if (cut <= 0) cut = width;
      chunks.add(rest.substring(0, cut).trim());
      rest = rest.substring(cut).trim();
    }
    if (!rest.isEmpty()) chunks.add(rest);
    return chunks;
  }
}

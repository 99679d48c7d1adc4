package com.gentoro.medrag.utility;

public class StringUtility {

  public static final String ELLIPSIS = "...";

  /**
   * Cut {@code input} to {@code maxChars} characters and append {@link #ELLIPSIS} when something
   * was removed. Inputs within the limit are returned unchanged.
   */
  public static String truncate(String input, int maxChars) {
    if (input == null) return "";
    if (maxChars < 0 || input.length() <= maxChars) return input;
    return input.substring(0, maxChars) + ELLIPSIS;
  }

  /** First {@code n} characters of {@code value}, or all of it when shorter. */
  public static String head(String value, int n) {
    if (value == null) return "";
    return value.length() <= n ? value : value.substring(0, n);
  }
}

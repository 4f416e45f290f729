package com.scholary.placeholdarr.status;

import java.util.regex.Pattern;

/** Builds catalog titles carrying a status suffix, and strips such suffixes again. */
public final class TitleFormatter {

  private static final String SEPARATOR = " - ";

  // Repeated suffixes can pile up when a previous rename was never reverted.
  private static final Pattern STATUS_SUFFIX =
      Pattern.compile(
          "\\s*-\\s*(\\[Request\\]|Searching\\.\\.\\.|Queued|Downloading(\\s+\\d{1,3}%|\\.\\.\\.)"
              + "|Processing\\.\\.\\.|Warning|Retrying\\.\\.\\.|Available|Not Found|Not Available)"
              + "\\s*$",
          Pattern.CASE_INSENSITIVE);

  private TitleFormatter() {}

  public static String compose(String baseTitle, DisplayStatus status) {
    return strip(baseTitle) + SEPARATOR + status.label();
  }

  public static String strip(String title) {
    if (title == null) {
      return "";
    }
    String previous;
    String current = title.trim();
    do {
      previous = current;
      current = STATUS_SUFFIX.matcher(current).replaceFirst("").trim();
    } while (!current.equals(previous));
    return current;
  }
}

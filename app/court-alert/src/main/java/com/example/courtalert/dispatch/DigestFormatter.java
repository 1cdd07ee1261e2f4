/*
 * Where: Court alert dispatch
 * What: Renders a digest as a subject line and a plain-text body
 * Why: Recipients read local wall-clock times, not UTC instants
 */
package com.example.courtalert.dispatch;

import com.example.courtalert.config.DispatchProperties;
import com.example.courtalert.config.EngineProperties;
import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.Digest;
import com.example.courtalert.model.DigestEntry;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DigestFormatter {

  private static final DateTimeFormatter DAY_AND_TIME =
      DateTimeFormatter.ofPattern("EEE yyyy-MM-dd HH:mm", Locale.ENGLISH);
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);

  private final EngineProperties engineProperties;
  private final DispatchProperties dispatchProperties;

  public String subject(Digest digest) {
    final int count = digest.entries().size();
    return dispatchProperties.subjectPrefix()
        + ": "
        + count
        + (count == 1 ? " new court window" : " new court windows");
  }

  public String body(Digest digest) {
    final StringBuilder body = new StringBuilder("New court availability matching your alert:\n\n");
    for (DigestEntry entry : digest.entries()) {
      body.append("- ")
          .append(entry.sourceName())
          .append(", court ")
          .append(entry.window().courtId())
          .append(": ")
          .append(describe(entry.window()))
          .append('\n');
    }
    return body.toString();
  }

  /** Formats a window as "Tue 2026-10-20 10:00-11:00", spelling out the end day when it differs. */
  public String describe(ConsolidatedWindow window) {
    final ZoneId zone = engineProperties.timeZone();
    final ZonedDateTime start = window.start().atZone(zone);
    final ZonedDateTime end = window.end().atZone(zone);
    if (start.toLocalDate().equals(end.toLocalDate())) {
      return DAY_AND_TIME.format(start) + "-" + TIME.format(end);
    }
    return DAY_AND_TIME.format(start) + " - " + DAY_AND_TIME.format(end);
  }
}

package com.scholary.subsearch.media;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses the {@code [Events]} section of an Advanced SubStation Alpha document.
 *
 * <p>ffmpeg converts any text subtitle track to ASS, so this is the only format we read. Field
 * order comes from the section's {@code Format:} line; {@code Text} is always the last field and
 * may itself contain commas.
 */
@Component
public class AssEventParser {

  // Example: 0:01:02.35
  private static final Pattern TIMESTAMP =
      Pattern.compile("(\\d+):(\\d{1,2}):(\\d{1,2})[.:](\\d{1,3})");
  private static final Pattern OVERRIDE_BLOCK = Pattern.compile("\\{[^}]*\\}");

  private static final List<String> DEFAULT_FORMAT =
      List.of(
          "layer", "start", "end", "style", "name", "marginl", "marginr", "marginv", "effect",
          "text");

  /**
   * Parse all Dialogue and Comment events.
   *
   * @param document the ASS document text
   * @return events in document order
   * @throws ExtractionException if an event line is malformed or there is no events section
   */
  public List<SubtitleCue> parse(String document) {
    List<SubtitleCue> cues = new ArrayList<>();
    List<String> format = DEFAULT_FORMAT;
    boolean inEvents = false;
    boolean sawEvents = false;

    for (String rawLine : document.split("\\r?\\n")) {
      String line = rawLine.strip();
      if (line.startsWith("[")) {
        inEvents = line.equalsIgnoreCase("[Events]");
        sawEvents |= inEvents;
        continue;
      }
      if (!inEvents || line.isEmpty()) {
        continue;
      }

      int colon = line.indexOf(':');
      if (colon < 0) {
        continue;
      }
      String kind = line.substring(0, colon).strip();
      String body = line.substring(colon + 1).stripLeading();

      if (kind.equalsIgnoreCase("Format")) {
        format =
            Arrays.stream(body.split(","))
                .map(f -> f.strip().toLowerCase(Locale.ROOT))
                .toList();
      } else if (kind.equalsIgnoreCase("Dialogue") || kind.equalsIgnoreCase("Comment")) {
        cues.add(parseEvent(body, format, kind.equalsIgnoreCase("Comment")));
      }
    }

    if (!sawEvents) {
      throw new ExtractionException("Subtitle document has no [Events] section");
    }
    return cues;
  }

  private SubtitleCue parseEvent(String body, List<String> format, boolean comment) {
    String[] fields = body.split(",", format.size());
    if (fields.length < format.size()) {
      throw new ExtractionException("Malformed subtitle event: " + body);
    }
    long start = parseTimestamp(fields[indexOf(format, "start")]);
    long end = parseTimestamp(fields[indexOf(format, "end")]);
    String text = fields[indexOf(format, "text")];
    return new SubtitleCue(start, Math.max(start, end), comment, plainText(text));
  }

  private static int indexOf(List<String> format, String field) {
    int index = format.indexOf(field);
    if (index < 0) {
      throw new ExtractionException("Subtitle event format has no '" + field + "' field");
    }
    return index;
  }

  /** Timestamp {@code H:MM:SS.cc} to milliseconds. */
  static long parseTimestamp(String value) {
    Matcher m = TIMESTAMP.matcher(value.strip());
    if (!m.matches()) {
      throw new ExtractionException("Malformed subtitle timestamp: " + value);
    }
    String fraction = m.group(4);
    long fractionMs = Long.parseLong(fraction) * (long) Math.pow(10, 3 - fraction.length());
    return ((Long.parseLong(m.group(1)) * 60 + Long.parseLong(m.group(2))) * 60
                + Long.parseLong(m.group(3)))
            * 1000
        + fractionMs;
  }

  /** Strip override blocks and turn ASS escapes into plain whitespace. */
  static String plainText(String text) {
    return OVERRIDE_BLOCK
        .matcher(text)
        .replaceAll("")
        .replace("\\h", " ")
        .replace("\\N", "\n")
        .replace("\\n", "\n");
  }
}

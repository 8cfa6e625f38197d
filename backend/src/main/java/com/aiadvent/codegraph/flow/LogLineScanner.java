package com.aiadvent.codegraph.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Textual scan for statements that write to a log or the console. */
@Component
public class LogLineScanner {

  private static final Pattern LOG_CALL =
      Pattern.compile(
          "\\b(?:log|logger|LOG|LOGGER|Log|logging|console|Timber)\\s*\\.\\s*"
              + "(?:trace|debug|info|warn|warning|error|fatal|critical|exception|log|"
              + "[vdiwe])\\s*\\(");
  private static final Pattern PRINT_CALL =
      Pattern.compile("\\b(?:println|print|printf|eprintln|eprint)!?\\s*\\(");
  private static final Pattern LOG_MACRO =
      Pattern.compile("\\b(?:trace|debug|info|warn|error)!\\s*\\(");

  /**
   * @param firstLine line number of the first line of {@code source}
   * @return matching lines as {@code "<line>: <trimmed text>"}
   */
  public List<String> scan(String source, int firstLine) {
    List<String> lines = new ArrayList<>();
    if (source == null || source.isEmpty()) {
      return lines;
    }
    String[] split = source.split("\\R", -1);
    for (int i = 0; i < split.length; i++) {
      String line = split[i];
      if (LOG_CALL.matcher(line).find()
          || PRINT_CALL.matcher(line).find()
          || LOG_MACRO.matcher(line).find()) {
        lines.add((firstLine + i) + ": " + line.trim());
      }
    }
    return lines;
  }
}

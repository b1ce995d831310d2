package com.consullo.relay.extract;

import com.consullo.relay.core.ControlSequences;
import com.consullo.relay.pattern.PatternCategory;
import com.consullo.relay.pattern.PatternLibrary;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Isolates the text the agent produced for one submission.
 *
 * <p>With a sentinel, the answer is whatever follows the sentinel's echo up to the next input prompt.
 * This survives scrolling and redraws of unrelated screen areas. Without one, the answer is the part
 * of {@code after} that extends {@code before}: the longest run of lines ending {@code before}
 * (minus its input box) that starts {@code after} is skipped.
 *
 * <p>Both strategies work on control-sequence-free text and drop input box furniture trailing the
 * answer. The result is a candidate only; chrome inside it is left to the sanitizer.
 *
 * @since 1.0
 */
public final class ResponseExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResponseExtractor.class);

  private final PatternLibrary patterns;

  public ResponseExtractor(PatternLibrary patterns) {
    Validate.notNull(patterns, "patterns must not be null");
    this.patterns = patterns;
  }

  /**
   * Diff-based extraction, for submissions that carried no sentinel.
   *
   * @param before capture taken before submitting
   * @param after capture taken at completion
   * @return candidate text, possibly empty
   */
  public String extract(String before, String after) {
    return extractByDiff(lines(before), lines(after));
  }

  /**
   * Marker-based extraction. Falls back to diff only when the sentinel's echo is no longer in
   * {@code after} (scrolled past the captured history).
   *
   * @param before capture taken before submitting
   * @param after capture taken at completion
   * @param sentinel token embedded in the submission, null for none
   * @return candidate text, possibly empty
   */
  public String extract(String before, String after, Sentinel sentinel) {
    if (sentinel == null) {
      return extract(before, after);
    }
    final List<String> afterLines = lines(after);
    final int markerLine = findSentinel(afterLines, sentinel.token());
    if (markerLine < 0) {
      LOGGER.warn("Sentinel {} not found in capture, using diff extraction", sentinel);
      return extractByDiff(lines(before), afterLines);
    }
    return untilPrompt(afterLines.subList(markerLine + 1, afterLines.size()));
  }

  private String extractByDiff(List<String> before, List<String> after) {
    final List<String> base = withoutTrailingFurniture(before);
    int start = overlap(base, after);
    if (start == 0 && !base.isEmpty()) {
      final int anchor = after.lastIndexOf(base.get(base.size() - 1));
      start = anchor >= 0 ? anchor + 1 : 0;
    }
    return untilPrompt(after.subList(start, after.size()));
  }

  /**
   * Largest k such that the last k lines of {@code base} are the first k lines of {@code after}.
   */
  private static int overlap(List<String> base, List<String> after) {
    for (int k = Math.min(base.size(), after.size()); k > 0; k--) {
      if (base.subList(base.size() - k, base.size()).equals(after.subList(0, k))) {
        return k;
      }
    }
    return 0;
  }

  /**
   * Index of the line on which the sentinel ends, also when the terminal wrapped it onto a second row.
   */
  private static int findSentinel(List<String> lines, String token) {
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).contains(token)) {
        return i;
      }
      if (i + 1 < lines.size()) {
        final String joined = lines.get(i) + lines.get(i + 1).stripLeading();
        if (joined.contains(token)) {
          return i + 1;
        }
      }
    }
    return -1;
  }

  private String untilPrompt(List<String> region) {
    final List<String> out = new ArrayList<>();
    for (String line : region) {
      if (patterns.matches(PatternCategory.IDLE_PROMPT, line)) {
        break;
      }
      out.add(line);
    }
    final List<String> body = withoutTrailingFurniture(out);
    int first = 0;
    while (first < body.size() && body.get(first).isBlank()) {
      first++;
    }
    return String.join("\n", body.subList(first, body.size()));
  }

  private List<String> withoutTrailingFurniture(List<String> lines) {
    int end = lines.size();
    while (end > 0) {
      final String line = lines.get(end - 1);
      if (line.isBlank()
          || patterns.matches(PatternCategory.IDLE_PROMPT, line)
          || patterns.matches(PatternCategory.UI_CHROME, line)) {
        end--;
      } else {
        break;
      }
    }
    return lines.subList(0, end);
  }

  private static List<String> lines(String capture) {
    final String[] raw = ControlSequences.strip(capture).split("\n", -1);
    final List<String> lines = new ArrayList<>(raw.length);
    for (String line : Arrays.asList(raw)) {
      lines.add(line.stripTrailing());
    }
    return lines;
  }
}

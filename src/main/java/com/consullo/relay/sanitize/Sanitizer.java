package com.consullo.relay.sanitize;

import com.consullo.relay.core.ControlSequences;
import com.consullo.relay.pattern.PatternCategory;
import com.consullo.relay.pattern.PatternLibrary;
import com.consullo.relay.pattern.PatternRule;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-pass cleaner for extracted answers.
 *
 * <p>The light pass always runs: control sequences, response bullets and lines the pattern table
 * calls chrome, tool echo, working indicator or idle prompt are removed. Each remaining line is then
 * checked for leakage (instruction echo, structured data, internal paths). Only if something leaked
 * does the aggressive pass run, deleting every leaking line. Fenced code blocks are left alone by
 * both passes.
 *
 * <p>{@code sanitize(sanitize(x).text()).text()} equals {@code sanitize(x).text()}.
 *
 * @since 1.0
 */
public final class Sanitizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(Sanitizer.class);

  private static final Set<PatternCategory> LIGHT = EnumSet.of(
      PatternCategory.UI_CHROME,
      PatternCategory.TOOL_ECHO,
      PatternCategory.WORKING_INDICATOR,
      PatternCategory.IDLE_PROMPT);

  private static final Pattern BULLET = Pattern.compile("^\\s*(?:[⏺●]\\s*)+");
  private static final Pattern FENCE = Pattern.compile("^\\s*(?:```|~~~)");

  private final PatternLibrary patterns;

  public Sanitizer(PatternLibrary patterns) {
    Validate.notNull(patterns, "patterns must not be null");
    this.patterns = patterns;
  }

  public SanitizeResult sanitize(String candidate) {
    final List<Line> lines = lightPass(ControlSequences.strip(candidate));

    final Set<String> leakRules = new LinkedHashSet<>();
    int leakLines = 0;
    int nonBlank = 0;
    for (Line line : lines) {
      if (!line.text().isBlank()) {
        nonBlank++;
      }
      if (line.leak() != null) {
        leakLines++;
        leakRules.add(line.leak().name());
      }
    }

    final boolean leakDetected = leakLines > 0;
    final boolean garbage = leakLines >= 2 && leakLines * 2 >= nonBlank;
    if (leakDetected) {
      LOGGER.info("Leak detected ({} of {} lines, rules {}), applying aggressive pass", leakLines, nonBlank, leakRules);
    }

    final List<String> kept = new ArrayList<>(lines.size());
    for (Line line : lines) {
      if (line.leak() == null) {
        kept.add(line.text());
      }
    }
    return new SanitizeResult(collapse(kept), leakDetected, new ArrayList<>(leakRules), garbage);
  }

  private List<Line> lightPass(String text) {
    final List<Line> out = new ArrayList<>();
    boolean inFence = false;
    for (String raw : text.split("\n", -1)) {
      // fences are recognized after the bullet is gone, as they will be in the cleaned text
      final String line = BULLET.matcher(raw.stripTrailing()).replaceFirst("");
      if (FENCE.matcher(line).find()) {
        inFence = !inFence;
        out.add(new Line(line, null));
        continue;
      }
      if (inFence) {
        out.add(new Line(raw.stripTrailing(), null));
        continue;
      }
      final Optional<PatternRule> rule = patterns.classifyLine(line);
      if (rule.isPresent() && LIGHT.contains(rule.get().category())) {
        continue;
      }
      out.add(new Line(line, rule.filter(r -> r.category().isLeak()).orElse(null)));
    }
    return out;
  }

  /**
   * Joins lines, dropping leading and trailing blank lines and folding blank runs into one.
   */
  private static String collapse(List<String> lines) {
    final StringBuilder sb = new StringBuilder();
    boolean pendingBlank = false;
    for (String line : lines) {
      if (line.isBlank()) {
        pendingBlank = sb.length() > 0;
        continue;
      }
      if (sb.length() > 0) {
        sb.append('\n');
        if (pendingBlank) {
          sb.append('\n');
        }
      }
      sb.append(line);
      pendingBlank = false;
    }
    return sb.toString();
  }

  private record Line(String text, PatternRule leak) {
  }
}

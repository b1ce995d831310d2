package com.consullo.relay.pattern;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Versioned, ordered table of line patterns.
 *
 * <p>The table is data: it is read from YAML at startup and nothing in the relay branches on a rule
 * name. Rule order is priority order; {@link #classifyLine(CharSequence)} returns the first hit.
 *
 * @since 1.0
 */
public final class PatternLibrary {

  private static final Logger LOGGER = LoggerFactory.getLogger(PatternLibrary.class);

  /** Classpath location of the bundled table. */
  public static final String DEFAULT_RESOURCE = "patterns.yaml";

  private final int version;
  private final List<PatternRule> rules;
  private final Map<PatternCategory, List<PatternRule>> byCategory;

  public PatternLibrary(int version, List<PatternRule> rules) {
    if (rules == null) {
      throw new IllegalArgumentException("rules must not be null.");
    }
    final Set<String> names = new HashSet<>();
    for (PatternRule rule : rules) {
      if (!names.add(rule.name())) {
        throw new PatternLibraryException("Duplicate rule name: " + rule.name());
      }
    }
    this.version = version;
    this.rules = List.copyOf(rules);
    this.byCategory = new EnumMap<>(PatternCategory.class);
    for (PatternCategory c : PatternCategory.values()) {
      byCategory.put(c, new ArrayList<>());
    }
    for (PatternRule rule : this.rules) {
      byCategory.get(rule.category()).add(rule);
    }
  }

  /**
   * Loads the table bundled with the relay.
   *
   * @return library
   */
  public static PatternLibrary loadDefault() {
    try (InputStream in = PatternLibrary.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new PatternLibraryException("Missing classpath resource " + DEFAULT_RESOURCE);
      }
      return load(in);
    } catch (IOException e) {
      throw new PatternLibraryException("Cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  /**
   * Reads a YAML pattern table.
   *
   * @param in YAML document with {@code version} and {@code rules}
   * @return library
   */
  public static PatternLibrary load(InputStream in) {
    final Definition definition;
    try {
      definition = new ObjectMapper(new YAMLFactory()).readValue(in, Definition.class);
    } catch (IOException e) {
      throw new PatternLibraryException("Malformed pattern table", e);
    }
    if (definition == null || definition.rules() == null) {
      throw new PatternLibraryException("Pattern table has no rules");
    }

    final List<PatternRule> rules = new ArrayList<>(definition.rules().size());
    for (RuleDefinition def : definition.rules()) {
      rules.add(compile(def));
    }
    final PatternLibrary library = new PatternLibrary(definition.version(), rules);
    LOGGER.info("Loaded pattern library v{} with {} rules", library.version(), rules.size());
    return library;
  }

  private static PatternRule compile(RuleDefinition def) {
    if (def.category() == null || def.pattern() == null) {
      throw new PatternLibraryException("Rule " + def.name() + " needs a category and a pattern");
    }
    final PatternCategory category;
    try {
      category = PatternCategory.valueOf(def.category().trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new PatternLibraryException("Rule " + def.name() + " has unknown category " + def.category(), e);
    }
    try {
      // \s must also cover the no-break spaces the agent UI pads with
      int flags = Pattern.UNICODE_CHARACTER_CLASS;
      if (def.caseInsensitive()) {
        flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
      }
      return new PatternRule(def.name(), category, Pattern.compile(def.pattern(), flags));
    } catch (PatternSyntaxException e) {
      throw new PatternLibraryException("Rule " + def.name() + " has an invalid pattern", e);
    }
  }

  public int version() {
    return version;
  }

  public List<PatternRule> rules() {
    return rules;
  }

  public List<PatternRule> rulesFor(PatternCategory category) {
    return List.copyOf(byCategory.get(category));
  }

  /**
   * First rule of {@code category} matching {@code line}.
   *
   * @param category category to test
   * @param line screen line
   * @return matching rule, if any
   */
  public Optional<PatternRule> firstMatch(PatternCategory category, CharSequence line) {
    for (PatternRule rule : byCategory.get(category)) {
      if (rule.matches(line)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  public boolean matches(PatternCategory category, CharSequence line) {
    return firstMatch(category, line).isPresent();
  }

  /**
   * First rule of the whole table matching {@code line}, in table order.
   *
   * @param line screen line
   * @return matching rule, if any
   */
  public Optional<PatternRule> classifyLine(CharSequence line) {
    for (PatternRule rule : rules) {
      if (rule.matches(line)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Definition(int version, List<RuleDefinition> rules) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RuleDefinition(String name, String category, String pattern, boolean caseInsensitive) {
  }
}

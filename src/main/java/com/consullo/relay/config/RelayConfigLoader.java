package com.consullo.relay.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link RelayConfig} from YAML.
 *
 * <p>The bundled {@value #DEFAULTS_RESOURCE} holds every setting. A user file only needs the keys it
 * changes: mappings are merged key by key, anything else (scalars, lists) replaces the default.
 */
public final class RelayConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelayConfigLoader.class);

  public static final String DEFAULTS_RESOURCE = "relay-defaults.yaml";

  /** System property naming the user configuration file. */
  public static final String CONFIG_PROPERTY = "relay.config";

  private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

  /**
   * Defaults merged with the file named by {@code -Drelay.config}, if set.
   *
   * @return configuration
   */
  public RelayConfig load() {
    final String property = System.getProperty(CONFIG_PROPERTY);
    return load(StringUtils.isBlank(property) ? Optional.empty() : Optional.of(Path.of(property)));
  }

  /**
   * @param userFile optional override file
   * @return configuration
   */
  public RelayConfig load(Optional<Path> userFile) {
    final ObjectNode merged = defaults();
    if (userFile.isPresent()) {
      final Path file = userFile.get();
      try (InputStream in = Files.newInputStream(file)) {
        merge(merged, read(in, file.toString()));
      } catch (IOException e) {
        throw new RelayConfigException("Cannot read configuration " + file, e);
      }
      LOGGER.info("Loaded relay configuration from {}", file);
    }
    return bind(merged);
  }

  /**
   * @param overrides YAML document with the keys to change
   * @return configuration
   */
  public RelayConfig load(InputStream overrides) {
    final ObjectNode merged = defaults();
    merge(merged, read(overrides, "overrides"));
    return bind(merged);
  }

  private ObjectNode defaults() {
    try (InputStream in = RelayConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new RelayConfigException("Missing classpath resource " + DEFAULTS_RESOURCE, null);
      }
      return read(in, DEFAULTS_RESOURCE);
    } catch (IOException e) {
      throw new RelayConfigException("Cannot read " + DEFAULTS_RESOURCE, e);
    }
  }

  private ObjectNode read(InputStream in, String source) {
    final JsonNode node;
    try {
      node = mapper.readTree(in);
    } catch (IOException e) {
      throw new RelayConfigException("Malformed YAML in " + source, e);
    }
    if (node == null || node.isMissingNode() || node.isNull()) {
      return mapper.createObjectNode();
    }
    if (!node.isObject()) {
      throw new RelayConfigException(source + " must be a YAML mapping", null);
    }
    return (ObjectNode) node;
  }

  static void merge(ObjectNode target, ObjectNode overrides) {
    final Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final JsonNode existing = target.get(field.getKey());
      if (existing != null && existing.isObject() && field.getValue().isObject()) {
        merge((ObjectNode) existing, (ObjectNode) field.getValue());
      } else {
        target.set(field.getKey(), field.getValue());
      }
    }
  }

  private RelayConfig bind(ObjectNode tree) {
    try {
      return mapper.treeToValue(tree, RelayConfig.class);
    } catch (IOException | IllegalArgumentException e) {
      throw new RelayConfigException("Invalid relay configuration: " + e.getMessage(), e);
    }
  }
}

package com.consullo.relay.compose;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes composed prompts too large for the line input to uniquely named files the agent can read.
 */
public final class ContextArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContextArtifactStore.class);
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final int NAME_ATTEMPTS = 5;

  private final Path directory;

  public ContextArtifactStore(Path directory) {
    Validate.notNull(directory, "directory must not be null");
    this.directory = directory.toAbsolutePath().normalize();
  }

  /**
   * Writes {@code content} to a new {@code context_<8hex>.md}.
   *
   * @param content composed prompt
   * @return absolute path of the artifact
   * @throws IOException if the file cannot be created
   */
  public Path write(String content) throws IOException {
    Files.createDirectories(directory);
    for (int attempt = 0; attempt < NAME_ATTEMPTS; attempt++) {
      final Path file = directory.resolve("context_" + randomHex() + ".md");
      try {
        Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        LOGGER.debug("Wrote context artifact {} ({} chars)", file, content.length());
        return file;
      } catch (FileAlreadyExistsException e) {
        LOGGER.debug("Artifact name collision on {}", file.getFileName());
      }
    }
    throw new IOException("Could not allocate a unique artifact name in " + directory);
  }

  /**
   * Removes an artifact once its turn is over. Failure only leaves a stray file behind.
   *
   * @param artifact file returned by {@link #write(String)}
   */
  public void delete(Path artifact) {
    try {
      Files.deleteIfExists(artifact);
    } catch (IOException e) {
      LOGGER.warn("Could not delete context artifact {}: {}", artifact, e.getMessage());
    }
  }

  private static String randomHex() {
    final byte[] bytes = new byte[4];
    RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}

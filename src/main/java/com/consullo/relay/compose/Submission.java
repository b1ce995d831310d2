package com.consullo.relay.compose;

import com.consullo.relay.extract.Sentinel;
import java.nio.file.Path;
import java.util.Optional;

/**
 * What gets typed into the session for one turn.
 *
 * @param line single line to submit, ending with the sentinel
 * @param sentinel token locating the answer in later captures
 * @param artifact side file holding the full prompt, null when submitted inline
 * @param composedLength length of the full composed prompt
 */
public record Submission(String line, Sentinel sentinel, Path artifact, int composedLength) {

  public boolean inline() {
    return artifact == null;
  }

  public Optional<Path> artifactPath() {
    return Optional.ofNullable(artifact);
  }
}

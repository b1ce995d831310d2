package com.consullo.relay.extract;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Unique token appended to a submission so its echo can be found again in a later capture.
 *
 * <p>Format {@code [ref:xxxxxxxx]}: short enough to rarely wrap, distinctive enough never to occur in
 * ordinary text.
 *
 * @param token the literal token text
 */
public record Sentinel(String token) {

  private static final Pattern FORMAT = Pattern.compile("\\[ref:[0-9a-f]{8}]");
  private static final SecureRandom RANDOM = new SecureRandom();

  public Sentinel {
    if (token == null || !FORMAT.matcher(token).matches()) {
      throw new IllegalArgumentException("Malformed sentinel: " + token);
    }
  }

  public static Sentinel generate() {
    final byte[] bytes = new byte[4];
    RANDOM.nextBytes(bytes);
    return new Sentinel("[ref:" + HexFormat.of().formatHex(bytes) + "]");
  }

  @Override
  public String toString() {
    return token;
  }
}

package com.consullo.relay.core;

/**
 * Reads what the interactive session currently shows.
 *
 * <p>A capture is plain text: rendered rows joined with {@code \n}, each right-trimmed, trailing blank
 * rows removed. Two captures of an unchanged screen are equal strings, which is what stability
 * detection relies on.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ScreenCapture {

  String capture();
}

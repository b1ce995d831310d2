package com.consullo.relay.support;

import com.consullo.relay.core.SessionTerminal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Fake agent session driven by a script of captures.
 *
 * <p>Until something is submitted, every capture returns the initial screen. Each submitted line is
 * handed to the responder, whose list becomes the next captures in order; the last one repeats.
 */
public final class ScriptedTerminal implements SessionTerminal {

  private final Function<String, List<String>> responder;
  private final List<String> submitted = new ArrayList<>();

  private List<String> script;
  private int index;
  private int captures;
  private int interrupts;
  private volatile boolean alive = true;

  public ScriptedTerminal(String initialScreen, Function<String, List<String>> responder) {
    this.script = List.of(initialScreen);
    this.responder = responder;
  }

  /** Terminal whose screens come from {@code screens} regardless of input. */
  public static ScriptedTerminal of(String initialScreen, String... screens) {
    return new ScriptedTerminal(initialScreen, line -> List.of(screens));
  }

  @Override
  public synchronized String capture() {
    captures++;
    final String screen = script.get(Math.min(index, script.size() - 1));
    index++;
    return screen;
  }

  @Override
  public synchronized void submitLine(String line) {
    submitted.add(line);
    script = responder.apply(line);
    index = 0;
  }

  @Override
  public synchronized void sendInterrupt() {
    interrupts++;
  }

  @Override
  public boolean isAlive() {
    return alive;
  }

  /** Makes the agent process look exited. */
  public void kill() {
    alive = false;
  }

  public synchronized List<String> submitted() {
    return List.copyOf(submitted);
  }

  public synchronized int captures() {
    return captures;
  }

  public synchronized int interrupts() {
    return interrupts;
  }
}

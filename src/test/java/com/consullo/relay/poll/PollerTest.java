package com.consullo.relay.poll;

import com.consullo.relay.classify.StateClassifier;
import com.consullo.relay.extract.ResponseExtractor;
import com.consullo.relay.pattern.PatternLibrary;
import com.consullo.relay.sanitize.SanitizeResult;
import com.consullo.relay.sanitize.Sanitizer;
import com.consullo.relay.support.MutableClock;
import com.consullo.relay.support.ScriptedTerminal;
import com.consullo.relay.support.Screens;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PollerTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(60);

  private static PatternLibrary patterns;

  private MutableClock clock;
  private Sleeper sleeper;

  @BeforeAll
  static void loadPatterns() {
    patterns = PatternLibrary.loadDefault();
  }

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    sleeper = duration -> clock.advance(duration);
  }

  private Poller poller(ScriptedTerminal terminal) {
    final PollerConfig config = new PollerConfig(500, 3, 12, 5_000, 10_000);
    return new Poller(terminal, new StateClassifier(patterns, 12), config, sleeper, clock);
  }

  @Test
  @DisplayName("Should complete on the poll where the idle screen has been seen threshold times")
  void waitForCompletion_StabilizesAfterWork_CompletesAtPollK() throws Exception {
    final String working = Screens.workingAfter("> question");
    final String done = Screens.idleAfter("> question", "", "answer");
    final ScriptedTerminal terminal = ScriptedTerminal.of(Screens.idle(), working, working, working, done);
    final Poller poller = poller(terminal);

    final String before = poller.submit("question");
    final PollResult result = poller.waitForCompletion(before, TIMEOUT, ProgressListener.NONE);

    assertThat(result.state()).isEqualTo(PollState.COMPLETED);
    assertThat(result.polls()).isEqualTo(6);
    assertThat(result.capture()).isEqualTo(done);
    assertThat(terminal.submitted()).containsExactly("question");
  }

  @Test
  @DisplayName("Should complete a ping at poll 5 with nothing to extract")
  void waitForCompletion_PingEcho_CompletesAtPollFive() throws Exception {
    final String echo = Screens.lines("> ping", "");
    final String idle = Screens.lines("> ping", "", "> ");
    final ScriptedTerminal terminal = ScriptedTerminal.of("", echo, echo, idle);
    final Poller poller = poller(terminal);

    final String before = poller.submit("ping");
    final PollResult result = poller.waitForCompletion(before, TIMEOUT, ProgressListener.NONE);

    assertThat(result.state()).isEqualTo(PollState.COMPLETED);
    assertThat(result.polls()).isEqualTo(5);

    final String extracted = new ResponseExtractor(patterns).extract(before, result.capture());
    final SanitizeResult clean = new Sanitizer(patterns).sanitize(extracted);
    assertThat(extracted).isEmpty();
    assertThat(clean.text()).isEmpty();
    assertThat(clean.leakDetected()).isFalse();
  }

  @Test
  @DisplayName("Should return at once when a permission prompt shows on the first poll")
  void waitForCompletion_PermissionOnFirstPoll_ReturnsImmediately() throws Exception {
    final String prompt = Screens.lines("⏺ Bash(rm -rf build)", "Do you want to proceed?", "❯ 1. Yes", "  2. No");
    final ScriptedTerminal terminal = ScriptedTerminal.of(Screens.idle(), prompt);
    final Poller poller = poller(terminal);

    final String before = poller.submit("clean up");
    final PollResult result = poller.waitForCompletion(before, TIMEOUT, ProgressListener.NONE);

    assertThat(result.state()).isEqualTo(PollState.PERMISSION_REQUESTED);
    assertThat(result.polls()).isEqualTo(1);
    assertThat(terminal.captures()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should not mistake the untouched idle screen for an answer")
  void waitForCompletion_ScreenNeverChanges_TimesOut() throws Exception {
    final ScriptedTerminal terminal = ScriptedTerminal.of(Screens.idle(), Screens.idle());
    final Poller poller = poller(terminal);

    final String before = poller.submit("hello");
    final PollResult result = poller.waitForCompletion(before, Duration.ofSeconds(2), ProgressListener.NONE);

    assertThat(result.state()).isEqualTo(PollState.TIMED_OUT);
    assertThat(result.polls()).isEqualTo(4);
    assertThat(result.elapsed()).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  @DisplayName("Should end on an error marker only once the screen is stable")
  void waitForCompletion_StableError_ReturnsError() throws Exception {
    final String error = Screens.idleAfter("> hi", "  ⎿  API Error: 529 overloaded");
    final ScriptedTerminal terminal = ScriptedTerminal.of(Screens.idle(), error);
    final Poller poller = poller(terminal);

    final String before = poller.submit("hi");
    final PollResult result = poller.waitForCompletion(before, TIMEOUT, ProgressListener.NONE);

    assertThat(result.state()).isEqualTo(PollState.ERROR);
    assertThat(result.polls()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should send progress after the delay and then at each interval")
  void waitForCompletion_LongTurn_NotifiesProgress() throws Exception {
    final ScriptedTerminal terminal = ScriptedTerminal.of(Screens.idle(), Screens.workingAfter("> slow"));
    final PollerConfig config = new PollerConfig(500, 3, 12, 1_000, 1_000);
    final Poller poller = new Poller(terminal, new StateClassifier(patterns, 12), config, sleeper, clock);
    final List<Duration> notified = new ArrayList<>();

    final String before = poller.submit("slow");
    final PollResult result = poller.waitForCompletion(before, Duration.ofMillis(3_500), notified::add);

    assertThat(result.state()).isEqualTo(PollState.TIMED_OUT);
    assertThat(notified).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3));
  }

  @Test
  @DisplayName("Should keep polling when a progress listener throws")
  void waitForCompletion_ListenerThrows_Continues() throws Exception {
    final String done = Screens.idleAfter("> q", "a");
    final List<String> script = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      script.add(Screens.workingAfter("> q"));
    }
    script.add(done);
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> script);
    final PollerConfig config = new PollerConfig(500, 3, 12, 500, 500);
    final Poller poller = new Poller(terminal, new StateClassifier(patterns, 12), config, sleeper, clock);

    final String before = poller.submit("q");
    final PollResult result = poller.waitForCompletion(before, TIMEOUT, elapsed -> {
      throw new IllegalStateException("listener broke");
    });

    assertThat(result.state()).isEqualTo(PollState.COMPLETED);
  }
}

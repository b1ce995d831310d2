package com.consullo.relay.session;

import com.consullo.relay.classify.StateClassifier;
import com.consullo.relay.compose.ComposerConfig;
import com.consullo.relay.compose.ContextArtifactStore;
import com.consullo.relay.compose.ContextComposer;
import com.consullo.relay.compose.ConversationBuffers;
import com.consullo.relay.compose.MemoryContextProvider;
import com.consullo.relay.extract.ResponseExtractor;
import com.consullo.relay.pattern.PatternLibrary;
import com.consullo.relay.poll.Poller;
import com.consullo.relay.poll.PollerConfig;
import com.consullo.relay.poll.Sleeper;
import com.consullo.relay.sanitize.Sanitizer;
import com.consullo.relay.support.MutableClock;
import com.consullo.relay.support.ScriptedTerminal;
import com.consullo.relay.support.Screens;
import com.consullo.relay.turn.CaptureRecord;
import com.consullo.relay.turn.TurnOutcome;
import com.consullo.relay.turn.TurnRequest;
import com.consullo.relay.turn.TurnResult;
import com.consullo.relay.turn.TurnState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

public class SessionArbiterTest {

  private static final String RESET = "/clear";

  private static PatternLibrary patterns;

  @TempDir
  Path artifactDir;

  private MutableClock clock;
  private ConversationBuffers buffers;
  private List<CaptureRecord> captured;
  private List<String> memoryQueries;

  @BeforeAll
  static void loadPatterns() {
    patterns = PatternLibrary.loadDefault();
  }

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-05-01T09:00:00Z");
    buffers = new ConversationBuffers(20);
    captured = new CopyOnWriteArrayList<>();
    memoryQueries = new CopyOnWriteArrayList<>();
  }

  private SessionArbiter arbiter(ScriptedTerminal terminal) {
    return arbiter(terminal, duration -> clock.advance(duration));
  }

  private SessionArbiter arbiter(ScriptedTerminal terminal, Sleeper sleeper) {
    final ArbiterConfig config = new ArbiterConfig("main", 60_000, 120_000, 2_000, 50, 600_000, RESET, true);
    final Poller poller = new Poller(terminal, new StateClassifier(patterns, 12),
        new PollerConfig(500, 3, 12, 5_000, 10_000), sleeper, clock);
    final ContextComposer composer = new ContextComposer(
        new ComposerConfig(1500, 20, 500, artifactDir.toString(), "UTC"), new ContextArtifactStore(artifactDir), clock);
    final MemoryContextProvider memory = query -> {
      memoryQueries.add(query);
      return "";
    };
    return SessionArbiter.builder()
        .config(config)
        .terminal(terminal)
        .poller(poller)
        .extractor(new ResponseExtractor(patterns))
        .sanitizer(new Sanitizer(patterns))
        .composer(composer)
        .buffers(buffers)
        .memory(memory)
        .captureSink(captured::add)
        .clock(clock)
        .build();
  }

  /** Agent that clears instantly and answers each prompt after a short think. */
  private static Function<String, List<String>> answering(String answer) {
    return line -> {
      if (line.equals(RESET)) {
        return List.of(Screens.idle());
      }
      final String working = Screens.workingAfter("> " + line);
      return List.of(working, working, Screens.idleAfter("> " + line, "", "⏺ " + answer));
    };
  }

  @Test
  @DisplayName("Should reset, submit and return the sanitized answer")
  void runTurn_FirstTurn_CompletesWithAnswer() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), answering("It is noon."));
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "what is the time?"));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.COMPLETED);
    assertThat(result.text()).isEqualTo("It is noon.");
    assertThat(result.leakDetected()).isFalse();
    assertThat(terminal.interrupts()).isEqualTo(1);
    assertThat(terminal.submitted()).hasSize(2);
    assertThat(terminal.submitted().get(0)).isEqualTo(RESET);
    assertThat(terminal.submitted().get(1)).matches("what is the time\\? \\[ref:[0-9a-f]{8}]");
    assertThat(arbiter.handle().loadedContextId()).contains("general");
    assertThat(arbiter.handle().lastActivity()).contains(result.endedAt());
    assertThat(buffers.snapshot("general")).hasSize(1);
    assertThat(memoryQueries).containsExactly("what is the time?");
    assertThat(arbiter.lock().isHeld()).isFalse();
  }

  @Test
  @DisplayName("Should hand the finished turn to the capture sink")
  void runTurn_Completed_RecordsCapture() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), answering("It is noon."));

    final TurnResult result = arbiter(terminal).runTurn(
        TurnRequest.conversational("general", "#general", "what is the time?"));

    assertThat(captured).hasSize(1);
    final CaptureRecord record = captured.get(0);
    assertThat(record.turnId()).isEqualTo(result.turnId());
    assertThat(record.finalState()).isEqualTo(TurnState.COMPLETED);
    assertThat(record.requestText()).isEqualTo("what is the time?");
    assertThat(record.submittedText()).startsWith("what is the time? [ref:");
    assertThat(record.captureAfter()).contains("It is noon.");
    assertThat(record.sanitizedText()).isEqualTo("It is noon.");
    assertThat(record.endedAt()).isAfter(record.startedAt());
  }

  @Test
  @DisplayName("Should keep the loaded context between turns of the same requester")
  void runTurn_SameContext_NoSecondReset() throws IOException {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), answering("Sure."));
    final SessionArbiter arbiter = arbiter(terminal);

    arbiter.runTurn(TurnRequest.conversational("general", "#general", "first"));
    final TurnResult second = arbiter.runTurn(TurnRequest.conversational("general", "#general", "second"));

    assertThat(second.outcome()).isEqualTo(TurnOutcome.COMPLETED);
    assertThat(terminal.submitted()).filteredOn(RESET::equals).hasSize(1);
    // history makes the second prompt go through an artifact, removed again afterwards
    assertThat(terminal.submitted().get(2)).startsWith("Read ").contains("context_");
    try (Stream<Path> files = Files.list(artifactDir)) {
      assertThat(files).isEmpty();
    }
    assertThat(buffers.snapshot("general")).hasSize(2);
  }

  @Test
  @DisplayName("Should reset when a different context takes the session")
  void runTurn_ContextSwitch_ResetsAgain() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), answering("Done."));
    final SessionArbiter arbiter = arbiter(terminal);

    arbiter.runTurn(TurnRequest.conversational("general", "#general", "hello"));
    final TurnResult job = arbiter.runTurn(TurnRequest.scheduledJob("morning-briefing", "#briefings", "brief me", false));

    assertThat(job.outcome()).isEqualTo(TurnOutcome.COMPLETED);
    assertThat(terminal.submitted()).filteredOn(RESET::equals).hasSize(2);
    assertThat(terminal.interrupts()).isEqualTo(2);
    assertThat(arbiter.handle().loadedContextId()).contains("morning-briefing");
    assertThat(memoryQueries).containsExactly("hello");
    assertThat(buffers.snapshot("morning-briefing")).isEmpty();
  }

  @Test
  @DisplayName("Should answer BUSY without touching the session while another turn holds it")
  void runTurn_LockHeld_Busy() throws Exception {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), answering("x"));
    final SessionArbiter arbiter = arbiter(terminal);
    final SessionLock.Lease lease = arbiter.lock().tryAcquire("SCHEDULED_JOB:nightly", Duration.ofMillis(10)).orElseThrow();

    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "hi"));
    lease.close();

    assertThat(result.outcome()).isEqualTo(TurnOutcome.BUSY);
    assertThat(result.detail()).contains("SCHEDULED_JOB:nightly");
    assertThat(terminal.submitted()).isEmpty();
    assertThat(captured).isEmpty();
  }

  @Test
  @DisplayName("Should refuse a second caller while a turn is in flight")
  void runTurn_Concurrent_SecondCallerBusy() throws Exception {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch proceed = new CountDownLatch(1);
    final Function<String, List<String>> agent = answering("first answer");
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> {
      if (!line.equals(RESET)) {
        entered.countDown();
        try {
          proceed.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      return agent.apply(line);
    });
    final SessionArbiter arbiter = arbiter(terminal);
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<TurnResult> first = executor.submit(
          () -> arbiter.runTurn(TurnRequest.conversational("general", "#general", "first")));
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

      final TurnResult second = arbiter.runTurn(TurnRequest.conversational("random", "#random", "second"));
      proceed.countDown();

      assertThat(second.outcome()).isEqualTo(TurnOutcome.BUSY);
      assertThat(first.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(TurnOutcome.COMPLETED);
      assertThat(terminal.submitted()).hasSize(2);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should report a permission prompt and force a reset on the next turn")
  void runTurn_PermissionPrompt_PermissionRequested() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> line.equals(RESET)
        ? List.of(Screens.idle())
        : List.of(Screens.lines("> " + line, "", "⏺ Bash(rm -rf build)", "",
            " Do you want to proceed?", " ❯ 1. Yes", "   2. No, and tell Claude what to do differently")));
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "clean up"));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.PERMISSION_REQUESTED);
    assertThat(result.text()).isEmpty();
    assertThat(arbiter.handle().loadedContextId()).isEmpty();
    assertThat(arbiter.lock().isHeld()).isFalse();
  }

  @Test
  @DisplayName("Should time out with the partial answer seen so far")
  void runTurn_NeverSettles_TimedOutWithPartialText() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> line.equals(RESET)
        ? List.of(Screens.idle())
        : List.of(Screens.workingAfter("> " + line, "", "⏺ The first half of the answer")));
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(
        TurnRequest.conversational("general", "#general", "long question").withTimeout(Duration.ofSeconds(5)));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.TIMED_OUT);
    assertThat(result.text()).isEqualTo("The first half of the answer");
    assertThat(arbiter.handle().loadedContextId()).isEmpty();
    assertThat(captured).extracting(CaptureRecord::finalState).containsExactly(TurnState.TIMED_OUT);
  }

  @Test
  @DisplayName("Should give up when the context reset does not settle")
  void runTurn_ResetNeverSettles_ContextResetFailed() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(),
        line -> List.of(Screens.workingAfter("> " + line)));
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "hi"));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.CONTEXT_RESET_FAILED);
    assertThat(terminal.submitted()).containsExactly(RESET);
    assertThat(arbiter.handle().loadedContextId()).isEmpty();
    assertThat(arbiter.lock().isHeld()).isFalse();
  }

  @Test
  @DisplayName("Should resubmit once when the answer is empty, then report it")
  void runTurn_EmptyTwice_EmptyResponse() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> line.equals(RESET)
        ? List.of(Screens.idle())
        : List.of(Screens.idleAfter("> " + line)));
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "ping"));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.EMPTY_RESPONSE);
    assertThat(terminal.submitted()).hasSize(3);
    assertThat(terminal.submitted().get(1)).isNotEqualTo(terminal.submitted().get(2));
    assertThat(buffers.snapshot("general")).isEmpty();
  }

  @Test
  @DisplayName("Should complete when the resubmitted prompt gets an answer")
  void runTurn_EmptyThenAnswer_Completed() {
    final AtomicInteger prompts = new AtomicInteger();
    final Function<String, List<String>> agent = answering("Pong.");
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> {
      if (!line.equals(RESET) && prompts.incrementAndGet() == 1) {
        return List.of(Screens.idleAfter("> " + line));
      }
      return agent.apply(line);
    });

    final TurnResult result = arbiter(terminal).runTurn(TurnRequest.conversational("general", "#general", "ping"));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.COMPLETED);
    assertThat(result.text()).isEqualTo("Pong.");
    assertThat(prompts.get()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should end ERRORED and release the session when a collaborator throws")
  void runTurn_TerminalThrows_ErroredAndReleased() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> {
      if (line.equals(RESET)) {
        return List.of(Screens.idle());
      }
      throw new IllegalStateException("pty closed");
    });
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "hi"));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.ERRORED);
    assertThat(result.detail()).contains("pty closed");
    assertThat(arbiter.lock().isHeld()).isFalse();
    assertThat(arbiter.lock().releases()).isEqualTo(arbiter.lock().acquisitions());
    assertThat(arbiter.handle().loadedContextId()).isEmpty();
    assertThat(captured).hasSize(1);
  }

  @Test
  @DisplayName("Should refuse turns once closed")
  void runTurn_Closed_Errored() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), answering("x"));
    final SessionArbiter arbiter = arbiter(terminal);

    arbiter.close();
    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "hi"));

    assertThat(arbiter.isClosed()).isTrue();
    assertThat(result.outcome()).isEqualTo(TurnOutcome.ERRORED);
    assertThat(result.detail()).isEqualTo("shutting down");
    assertThat(terminal.submitted()).isEmpty();
  }

  @Test
  @DisplayName("Should end a turn whose shutdown arrives mid-poll and release the session")
  void runTurn_ClosedWhilePolling_ErroredAndReleased() throws Exception {
    final AtomicBoolean prompted = new AtomicBoolean();
    final CountDownLatch polling = new CountDownLatch(1);
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> {
      if (line.equals(RESET)) {
        return List.of(Screens.idle());
      }
      prompted.set(true);
      return List.of(Screens.workingAfter("> " + line));
    });
    final SessionArbiter arbiter = arbiter(terminal, duration -> {
      if (prompted.get()) {
        polling.countDown();
        new CountDownLatch(1).await();
      }
      clock.advance(duration);
    });
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<TurnResult> turn = executor.submit(
          () -> arbiter.runTurn(TurnRequest.conversational("general", "#general", "long question")));
      assertThat(polling.await(5, TimeUnit.SECONDS)).isTrue();

      arbiter.close();
      final TurnResult result = turn.get(5, TimeUnit.SECONDS);

      assertThat(result.outcome()).isEqualTo(TurnOutcome.ERRORED);
      assertThat(result.detail()).isEqualTo("shutting down");
      assertThat(arbiter.lock().isHeld()).isFalse();
      assertThat(arbiter.lock().releases()).isEqualTo(arbiter.lock().acquisitions());
      assertThat(captured).extracting(CaptureRecord::finalState).containsExactly(TurnState.ERRORED);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should fail fast without touching the screen when the agent process has exited")
  void runTurn_AgentDead_ErroredImmediately() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), answering("x"));
    terminal.kill();
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(TurnRequest.conversational("general", "#general", "hi"));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.ERRORED);
    assertThat(result.detail()).isEqualTo("agent process not running");
    assertThat(result.endedAt()).isEqualTo(result.startedAt());
    assertThat(terminal.captures()).isZero();
    assertThat(terminal.submitted()).isEmpty();
    assertThat(arbiter.handle().loadedContextId()).isEmpty();
    assertThat(arbiter.lock().isHeld()).isFalse();
    assertThat(captured).hasSize(1);
  }

  @Test
  @DisplayName("Should cut a requested timeout longer than the maximum hold to fit inside it")
  void runTurn_TimeoutBeyondMaxHold_EndsWithinMaxHold() {
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> line.equals(RESET)
        ? List.of(Screens.idle())
        : List.of(Screens.workingAfter("> " + line)));
    final SessionArbiter arbiter = arbiter(terminal);

    final TurnResult result = arbiter.runTurn(TurnRequest.scheduledJob("nightly-export", "#ops", "export everything", false)
        .withTimeout(Duration.ofMinutes(30)));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.TIMED_OUT);
    assertThat(Duration.between(result.startedAt(), result.endedAt())).isLessThanOrEqualTo(Duration.ofMinutes(10));
    assertThat(arbiter.lock().isHeld()).isFalse();
    assertThat(arbiter.lock().releases()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should stop an overdue turn before the next turn drives the session")
  void runTurn_OverdueHolder_InterruptedBeforeNextTurn() throws Exception {
    final List<String> events = new CopyOnWriteArrayList<>();
    final AtomicBoolean exportStarted = new AtomicBoolean();
    final CountDownLatch stuck = new CountDownLatch(1);
    final Function<String, List<String>> agent = answering("Hello.");
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> {
      events.add(Thread.currentThread().getName() + (line.equals(RESET) ? ":reset" : ":prompt"));
      if (line.startsWith("export everything")) {
        exportStarted.set(true);
        return List.of(Screens.workingAfter("> " + line));
      }
      return agent.apply(line);
    });
    final SessionArbiter arbiter = arbiter(terminal, duration -> {
      if (exportStarted.get() && Thread.currentThread().getName().equals("export-turn")) {
        stuck.countDown();
        try {
          new CountDownLatch(1).await();
        } catch (InterruptedException e) {
          events.add("export-turn:interrupted");
          throw e;
        }
      }
      clock.advance(duration);
    });
    final ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "export-turn"));
    try {
      final Future<TurnResult> export = executor.submit(() -> arbiter.runTurn(
          TurnRequest.scheduledJob("nightly-export", "#ops", "export everything", false)
              .withTimeout(Duration.ofMinutes(30))));
      assertThat(stuck.await(5, TimeUnit.SECONDS)).isTrue();
      clock.advance(Duration.ofMinutes(11));

      final TurnResult next = arbiter.runTurn(TurnRequest.conversational("general", "#general", "hello"));

      assertThat(next.outcome()).isEqualTo(TurnOutcome.COMPLETED);
      assertThat(next.text()).isEqualTo("Hello.");
      final TurnResult overdue = export.get(5, TimeUnit.SECONDS);
      assertThat(overdue.outcome()).isEqualTo(TurnOutcome.ERRORED);
      assertThat(overdue.detail()).contains("maximum hold");

      final int interruptedAt = events.indexOf("export-turn:interrupted");
      assertThat(interruptedAt).isEqualTo(2);
      assertThat(events.subList(0, interruptedAt)).containsExactly("export-turn:reset", "export-turn:prompt");
      assertThat(events.subList(interruptedAt + 1, events.size()))
          .hasSize(2)
          .noneMatch(event -> event.startsWith("export-turn"));
      assertThat(arbiter.lock().isHeld()).isFalse();
      assertThat(arbiter.lock().acquisitions()).isEqualTo(2);
      assertThat(arbiter.lock().releases()).isEqualTo(2);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should pass interim progress to the requester on long turns")
  void runTurn_LongTurn_NotifiesProgress() {
    final List<Duration> progress = new ArrayList<>();
    final ScriptedTerminal terminal = new ScriptedTerminal(Screens.idle(), line -> {
      if (line.equals(RESET)) {
        return List.of(Screens.idle());
      }
      final List<String> screens = new ArrayList<>();
      for (int i = 0; i < 14; i++) {
        screens.add(Screens.workingAfter("> " + line, "", "step " + i));
      }
      screens.add(Screens.idleAfter("> " + line, "", "⏺ Finished."));
      return screens;
    });

    final TurnResult result = arbiter(terminal).runTurn(
        TurnRequest.scheduledJob("report", "#reports", "build the report", true).withProgress(progress::add));

    assertThat(result.outcome()).isEqualTo(TurnOutcome.COMPLETED);
    assertThat(result.text()).isEqualTo("Finished.");
    assertThat(progress).containsExactly(Duration.ofSeconds(5));
  }
}

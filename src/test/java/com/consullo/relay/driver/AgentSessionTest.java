package com.consullo.relay.driver;

import com.consullo.relay.core.jediterm.JediTermCore;
import com.consullo.relay.pty.PtyProcessController;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public final class AgentSessionTest {

  private PtyProcessController pty;
  private ByteArrayOutputStream keystrokes;
  private CompletableFuture<Integer> exit;

  @BeforeEach
  public void setUp() throws Exception {
    pty = mock(PtyProcessController.class);
    keystrokes = new ByteArrayOutputStream();
    when(pty.getPtyInput()).thenReturn(keystrokes);
    exit = new CompletableFuture<>();
    when(pty.onExit()).thenReturn(exit);
  }

  private AgentSession start(String output) throws Exception {
    final InputStream in = new ByteArrayInputStream(output.getBytes(StandardCharsets.UTF_8));
    when(pty.getPtyOutput()).thenReturn(in);
    return AgentSession.start(pty, new JediTermCore(60, 5, 100), 20, 0);
  }

  private static String awaitCapture(AgentSession session, String expected) throws InterruptedException {
    final long deadline = System.currentTimeMillis() + 5_000;
    String capture = session.capture();
    while (!capture.contains(expected) && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
      capture = session.capture();
    }
    return capture;
  }

  @Test
  public void agentOutputIsRenderedIntoCaptures() throws Exception {
    final AgentSession session = start("\u001B[1mWelcome\u001B[0m\r\n\r\n> ");

    assertThat(awaitCapture(session, "Welcome")).isEqualTo("Welcome\n\n>");
  }

  @Test
  public void submitLineTypesTextThenEnter() throws Exception {
    final AgentSession session = start("");

    session.submitLine("what is the time? [ref:0a1b2c3d]");

    assertThat(keystrokes.toString(StandardCharsets.UTF_8)).isEqualTo("what is the time? [ref:0a1b2c3d]\r");
  }

  @Test
  public void submitLineRejectsLineBreaks() throws Exception {
    final AgentSession session = start("");

    assertThatThrownBy(() -> session.submitLine("two\nlines")).isInstanceOf(IllegalArgumentException.class);
    assertThat(keystrokes.size()).isZero();
  }

  @Test
  public void interruptSendsEscape() throws Exception {
    final AgentSession session = start("");

    session.sendInterrupt();

    assertThat(keystrokes.toByteArray()).containsExactly(0x1B);
  }

  @Test
  public void closedSessionIsNotAlive() throws Exception {
    when(pty.isAlive()).thenReturn(true);
    final AgentSession session = start("");
    assertThat(session.isAlive()).isTrue();

    session.close();

    assertThat(session.isAlive()).isFalse();
    verify(pty).close();
  }

  @Test
  public void exitedAgentIsNotAlive() throws Exception {
    when(pty.isAlive()).thenReturn(true);
    final AgentSession session = start("");

    exit.complete(1);

    assertThat(session.isAlive()).isFalse();
  }

  @Test
  public void failingLivenessCheckCountsAsDead() throws Exception {
    when(pty.isAlive()).thenThrow(new IllegalStateException("gone"));
    final AgentSession session = start("");

    assertThat(session.isAlive()).isFalse();
  }

  @Test
  public void environmentCarriesTerminalContract() {
    final AgentSessionConfig config = new AgentSessionConfig(List.of("claude"), "", true, 120, 40, 1000, 100, 0,
        Map.of("ANTHROPIC_LOG", "error"));

    final Map<String, String> env = AgentSessionFactory.environment(config);

    assertThat(env).containsEntry("TERM", "xterm-256color")
        .containsEntry("CI", "1")
        .containsEntry("ANTHROPIC_LOG", "error");
  }
}

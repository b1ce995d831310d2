package com.consullo.relay.demo;

import com.consullo.relay.config.RelayConfig;
import com.consullo.relay.config.RelayConfigLoader;
import com.consullo.relay.runtime.RelayRuntime;
import com.consullo.relay.turn.TurnRequest;
import com.consullo.relay.turn.TurnResult;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat with the agent through the relay from a terminal.
 *
 * <p>Each line read from stdin is one conversational turn on the {@code console} context; the cleaned
 * answer (or the outcome, when there is none) is printed to stdout. A line starting with {@code !job }
 * runs as a scheduled job instead, which forces a context reset. An optional argument names a YAML
 * configuration file.
 *
 * @since 1.0
 */
public final class RelayConsole {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelayConsole.class);

  private static final String CONTEXT = "console";
  private static final String JOB_PREFIX = "!job ";

  private RelayConsole() {
  }

  /**
   * Console entry point.
   *
   * @param args optional configuration file
   * @throws Exception if the relay cannot start
   */
  public static void main(final String[] args) throws Exception {
    final RelayConfigLoader loader = new RelayConfigLoader();
    final RelayConfig config = args.length > 0 ? loader.load(Optional.of(Path.of(args[0]))) : loader.load();

    try (RelayRuntime runtime = RelayRuntime.start(config);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
      Runtime.getRuntime().addShutdownHook(new Thread(runtime.arbiter()::close, "RelayConsoleShutdown"));
      System.out.println("Relay ready. Type a message, '!job <text>' for a job, or an empty line to quit.");
      String line;
      while ((line = in.readLine()) != null && !line.isBlank()) {
        final TurnRequest request = line.startsWith(JOB_PREFIX)
            ? TurnRequest.scheduledJob("console-job", "stdout", line.substring(JOB_PREFIX.length()), false)
            : TurnRequest.conversational(CONTEXT, "stdout", line);
        final TurnResult result = runtime.arbiter().runTurn(request.withProgress(
            elapsed -> System.out.println("... still working (" + elapsed.toSeconds() + "s)")));
        print(result);
      }
    }
    LOGGER.info("Console closed");
  }

  private static void print(TurnResult result) {
    if (!result.text().isEmpty()) {
      System.out.println(result.text());
    }
    if (!result.completed()) {
      System.out.println("[" + result.outcome() + "] " + result.detail());
    }
  }
}

package com.leadpilot.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Interactive operator console on stdin/stdout.
 *
 * Enabled with {@code leadpilot.console.enabled=true}. Reads on its own daemon
 * thread so the web surface keeps starting normally; "quit" ends the console only.
 */
@Component
@ConditionalOnProperty(name = "leadpilot.console.enabled", havingValue = "true")
public class ConsoleRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRunner.class);

    private final CommandDispatcher dispatcher;

    public ConsoleRunner(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void run(String... args) {
        Thread t = new Thread(() -> loop(System.in, System.out), "console");
        t.setDaemon(true);
        t.start();
    }

    void loop(InputStream in, PrintStream out) {
        out.println(CommandDispatcher.HELP);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            out.print("> ");
            while ((line = reader.readLine()) != null) {
                String cmd = line.strip();
                if (cmd.equalsIgnoreCase("quit") || cmd.equalsIgnoreCase("exit")) {
                    break;
                }
                if (!cmd.isEmpty()) {
                    CommandResult result = dispatcher.dispatch(cmd);
                    out.println(result.ok() ? result.message() : "error: " + result.message());
                }
                out.print("> ");
            }
        } catch (IOException e) {
            log.error("Console input failed: {}", e.getMessage(), e);
        }
        log.info("Console closed");
    }
}

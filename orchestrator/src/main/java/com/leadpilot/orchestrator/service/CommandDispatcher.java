package com.leadpilot.orchestrator.service;

import com.leadpilot.orchestrator.memory.MemoryManager;
import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionSummary;
import com.leadpilot.orchestrator.provider.dto.Contact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Text command surface shared by the console and any line-based channel.
 *
 * <pre>
 *   analyze &lt;input&gt;        start a new execution, e.g. "analyze Acme, Roles: CTO"
 *   resume &lt;id | N&gt;        continue an execution (N = position in history)
 *   stop                    pause the running execution at its next safe point
 *   history                 list resumable executions, numbered, then recent ones
 *   forget &lt;entity&gt;        delete long-term memory of an entity
 *   enrich &lt;name&gt; at &lt;company&gt;   look up one person's contact details
 *   help
 * </pre>
 */
@Component
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final int HISTORY_LIMIT = 10;

    static final String HELP = """
            Commands:
              analyze <company>[, Roles: r1, r2]   start a new analysis
              resume <id | N>                      continue execution N from 'history'
              stop                                 pause the running analysis
              history                              list resumable and recent executions
              forget <company>                     delete what was learned about a company
              enrich <name> at <company>           look up one person, e.g. "enrich Jane Doe at Acme"
              help                                 show this text""";

    private final PipelineRunner      runner;
    private final ExecutionStateStore store;
    private final MemoryManager       memory;
    private final PersonEnricher      enricher;

    public CommandDispatcher(PipelineRunner runner, ExecutionStateStore store, MemoryManager memory,
                             PersonEnricher enricher) {
        this.runner   = runner;
        this.store    = store;
        this.memory   = memory;
        this.enricher = enricher;
    }

    public CommandResult dispatch(String line) {
        String text = line == null ? "" : line.strip();
        if (text.isEmpty()) {
            return CommandResult.error("Empty command. " + HELP);
        }
        int space = text.indexOf(' ');
        String verb = (space < 0 ? text : text.substring(0, space)).toLowerCase(Locale.ROOT);
        String arg  = space < 0 ? "" : text.substring(space + 1).strip();

        log.debug("Command '{}' arg='{}'", verb, arg);
        try {
            return switch (verb) {
                case "analyze" -> analyze(arg);
                case "resume"  -> resume(arg);
                case "stop"    -> stop();
                case "history" -> history();
                case "forget"  -> forget(arg);
                case "enrich"  -> enrich(arg);
                case "help"    -> CommandResult.ok(HELP);
                default        -> CommandResult.error("Unknown command '" + verb + "'. " + HELP);
            };
        } catch (NoActiveExecutionException | AlreadyCompletedException | ExecutionNotFoundException
                 | ExecutionAlreadyRunningException | IllegalArgumentException e) {
            return CommandResult.error(e.getMessage());
        }
    }

    private CommandResult analyze(String input) {
        Execution e = runner.submit(input);
        return CommandResult.ok("Started analysis of " + e.getEntity() + " (" + e.getId() + ")", e.getId());
    }

    private CommandResult resume(String reference) {
        if (reference.isEmpty()) {
            return CommandResult.error("Usage: resume <id | N>");
        }
        String id = runner.resume(reference);
        return CommandResult.ok("Resuming execution " + id, id);
    }

    private CommandResult stop() {
        runner.stop();
        return CommandResult.ok("Stop requested; the analysis will pause at the next safe point");
    }

    private CommandResult history() {
        List<Execution> resumable = store.listResumable();
        StringBuilder sb = new StringBuilder();
        if (resumable.isEmpty()) {
            sb.append("No resumable executions.\n");
        } else {
            sb.append("Resumable:\n");
            for (int i = 0; i < resumable.size(); i++) {
                sb.append("  ").append(i + 1).append(". ").append(describe(ExecutionSummary.from(resumable.get(i))))
                        .append('\n');
            }
        }
        List<Execution> recent = store.listAll().stream()
                .filter(e -> !e.getStatus().isResumable())
                .limit(HISTORY_LIMIT)
                .toList();
        if (!recent.isEmpty()) {
            sb.append("Recent:\n");
            recent.forEach(e -> sb.append("  - ").append(describe(ExecutionSummary.from(e))).append('\n'));
        }
        return CommandResult.ok(sb.toString().stripTrailing());
    }

    private CommandResult forget(String entity) {
        if (entity.isEmpty()) {
            return CommandResult.error("Usage: forget <company>");
        }
        return memory.forget(entity)
                ? CommandResult.ok("Forgot " + entity)
                : CommandResult.ok("Nothing remembered about " + entity);
    }

    private CommandResult enrich(String arg) {
        int at = arg.toLowerCase(Locale.ROOT).indexOf(" at ");
        if (at < 0) {
            return CommandResult.error("Usage: enrich <name> at <company>");
        }
        PersonLookup r = enricher.enrich(arg.substring(0, at), arg.substring(at + 4));
        if (!r.found()) {
            return CommandResult.error(r.error() + " (providers: "
                    + (r.configured().isEmpty() ? "none" : String.join(", ", r.configured())) + ")");
        }
        Contact c = r.contact();
        StringBuilder sb = new StringBuilder(c.fullName()).append(" at ").append(r.company());
        if (c.title() != null && !c.title().isEmpty()) {
            sb.append(", ").append(c.title());
        }
        sb.append("\n  email: ").append(c.hasEmail() ? c.email() : "not found");
        if (c.phone() != null && !c.phone().isEmpty()) {
            sb.append("\n  phone: ").append(c.phone());
        }
        if (c.linkedin_url() != null && !c.linkedin_url().isEmpty()) {
            sb.append("\n  linkedin: ").append(c.linkedin_url());
        }
        return CommandResult.ok(sb.append("\n  source: ").append(c.source()).toString());
    }

    private static String describe(ExecutionSummary s) {
        StringBuilder sb = new StringBuilder()
                .append(s.entity()).append(" [").append(s.status().wireName()).append("] ")
                .append(s.completedStages()).append(" stages done");
        if (s.resumeStage() != null) {
            sb.append(", next: ").append(s.resumeStage());
        }
        if (s.error() != null) {
            sb.append(" (").append(s.error()).append(')');
        }
        return sb.append("  ").append(s.id()).toString();
    }
}

package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.stage.Stage;
import com.leadpilot.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Base for stages that ask Claude for a JSON object.
 */
abstract class PromptedStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(PromptedStage.class);

    protected final ClaudeClient claude;
    protected final StagePrompts prompts;
    protected final ObjectMapper json;
    protected final String       model;

    protected PromptedStage(ClaudeClient claude, StagePrompts prompts, ObjectMapper json, String model) {
        this.claude  = claude;
        this.prompts = prompts;
        this.json    = json;
        this.model   = model;
    }

    /**
     * One LLM turn. The stage's context bundle is appended to {@code request}.
     * Checks for a stop request first so an interrupted run does not spend a call.
     */
    protected ObjectNode ask(StageContext ctx, String request) {
        ctx.checkCancelled();
        String context = ctx.context() == null ? "" : ctx.context().render();
        String user = context.isEmpty() ? request : request + "\n\n" + context;

        String name = definition().name();
        log.debug("Asking {} for stage '{}' ({} chars of input)", model, name, user.length());
        String response = claude.complete(model, prompts.get(name), List.of(ClaudeClient.Message.user(user)));
        return ResponseParser.parseObject(response, json);
    }
}

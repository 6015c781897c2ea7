package com.leadpilot.orchestrator.api;

import com.leadpilot.orchestrator.api.dto.AcceptedResponse;
import com.leadpilot.orchestrator.api.dto.AnalyzeRequest;
import com.leadpilot.orchestrator.api.dto.ExecutionResponse;
import com.leadpilot.orchestrator.model.Execution;
import com.leadpilot.orchestrator.model.ExecutionSummary;
import com.leadpilot.orchestrator.service.ExecutionNotFoundException;
import com.leadpilot.orchestrator.service.ExecutionStateStore;
import com.leadpilot.orchestrator.service.PipelineRunner;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for execution lifecycle.
 *
 * POST /executions                 start an analysis             → 202
 * POST /executions/{ref}/resume    resume by id or history index → 202
 * POST /executions/stop            pause the running execution   → 202
 * GET  /executions                 history, newest first
 * GET  /executions/resumable       resumable executions, newest first
 * GET  /executions/{id}            one execution with its stage results
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final PipelineRunner      runner;
    private final ExecutionStateStore store;

    public ExecutionController(PipelineRunner runner, ExecutionStateStore store) {
        this.runner = runner;
        this.store  = store;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/executions \
     *     -H "Content-Type: application/json" \
     *     -d '{"input":"Acme, Roles: CTO, VP Sales"}'
     */
    @PostMapping
    public ResponseEntity<AcceptedResponse> analyze(@RequestBody AnalyzeRequest req) {
        Execution e = runner.submit(req.input());
        return ResponseEntity.accepted()
                .body(new AcceptedResponse(e.getId(), "Started analysis of " + e.getEntity()));
    }

    @PostMapping("/{ref}/resume")
    public ResponseEntity<AcceptedResponse> resume(@PathVariable String ref) {
        String id = runner.resume(ref);
        return ResponseEntity.accepted().body(new AcceptedResponse(id, "Resuming execution " + id));
    }

    @PostMapping("/stop")
    public ResponseEntity<AcceptedResponse> stop() {
        runner.stop();
        return ResponseEntity.accepted()
                .body(new AcceptedResponse(null, "Stop requested; pausing at the next safe point"));
    }

    @GetMapping
    public List<ExecutionSummary> history() {
        return store.listAll().stream().map(ExecutionSummary::from).toList();
    }

    @GetMapping("/resumable")
    public List<ExecutionSummary> resumable() {
        return store.listResumable().stream().map(ExecutionSummary::from).toList();
    }

    @GetMapping("/{id}")
    public ExecutionResponse get(@PathVariable String id) {
        return store.find(id)
                .map(ExecutionResponse::from)
                .orElseThrow(() -> new ExecutionNotFoundException(id));
    }
}

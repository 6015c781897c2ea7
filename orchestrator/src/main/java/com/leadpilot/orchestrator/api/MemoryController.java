package com.leadpilot.orchestrator.api;

import com.leadpilot.orchestrator.api.dto.MemoryResponse;
import com.leadpilot.orchestrator.memory.EntityMemory;
import com.leadpilot.orchestrator.memory.MemoryManager;
import com.leadpilot.orchestrator.memory.RecallBudget;
import com.leadpilot.orchestrator.model.ResearchRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * GET    /memory/{entity}   what long-term memory holds about an entity
 * DELETE /memory/{entity}   forget it
 */
@RestController
@RequestMapping("/memory")
public class MemoryController {

    private final MemoryManager memory;

    public MemoryController(MemoryManager memory) {
        this.memory = memory;
    }

    @GetMapping("/{entity}")
    public MemoryResponse recall(@PathVariable String entity,
                                 @RequestParam(defaultValue = "50") int limit) {
        EntityMemory m = memory.entity(entity).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Nothing remembered about " + entity));
        return new MemoryResponse(
                ResearchRequest.normalize(entity),
                m.getDisplayName(),
                m.getTimesAnalyzed(),
                memory.recall(entity, RecallBudget.items(limit)));
    }

    @DeleteMapping("/{entity}")
    public ResponseEntity<Void> forget(@PathVariable String entity) {
        if (!memory.forget(entity)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Nothing remembered about " + entity);
        }
        return ResponseEntity.noContent().build();
    }
}

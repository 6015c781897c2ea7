package com.leadpilot.orchestrator.api;

import com.leadpilot.orchestrator.api.dto.EnrichRequest;
import com.leadpilot.orchestrator.service.PersonEnricher;
import com.leadpilot.orchestrator.service.PersonLookup;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /contacts/enrich   contact details for one named person, no pipeline run
 */
@RestController
@RequestMapping("/contacts")
public class ContactController {

    private final PersonEnricher enricher;

    public ContactController(PersonEnricher enricher) {
        this.enricher = enricher;
    }

    @PostMapping("/enrich")
    public ResponseEntity<PersonLookup> enrich(@RequestBody EnrichRequest req) {
        PersonLookup result = enricher.enrich(req.name(), req.company());
        return ResponseEntity.status(result.found() ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(result);
    }
}

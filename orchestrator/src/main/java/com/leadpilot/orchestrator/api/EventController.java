package com.leadpilot.orchestrator.api;

import com.leadpilot.orchestrator.events.EventBroadcaster;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Push channel: GET /events streams every pipeline event as server-sent events,
 * named after the event type (progress, log, result, error).
 */
@RestController
public class EventController {

    private final EventBroadcaster broadcaster;

    public EventController(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return broadcaster.subscribe();
    }
}

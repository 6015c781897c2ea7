package com.leadpilot.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link EventSink}: logs every event and fans it out to all
 * server-sent-event subscribers of {@code GET /events}.
 *
 * A subscriber whose connection fails is dropped; delivery to the others
 * continues.
 */
@Component
public class EventBroadcaster implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    /** Register a new push-channel subscriber. The emitter never times out on its own. */
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        emitters.add(emitter);
        log.debug("Event subscriber added ({} total)", emitters.size());
        return emitter;
    }

    public int subscriberCount() {
        return emitters.size();
    }

    @Override
    public void publish(PipelineEvent event) {
        switch (event.event()) {
            case ERROR -> log.warn("[{}] error stage={} {}", event.executionId(), event.stage(), event.error());
            case LOG   -> log.info("[{}] {}", event.executionId(), event.message());
            default    -> log.info("[{}] {} stage={} status={}", event.executionId(),
                    event.event().wireName(), event.stage(), event.status());
        }

        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(event.event().wireName())
                        .data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping event subscriber: {}", e.getMessage());
                emitters.remove(emitter);
            }
        }
    }
}

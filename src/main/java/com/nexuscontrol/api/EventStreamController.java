package com.nexuscontrol.api;

import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventType;
import com.nexuscontrol.store.EventLogService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Live feed of committed events. Only events appended after the client
 * connects are delivered; use the decision events endpoint for history.
 */
@RestController
@RequestMapping("/v1/events")
public class EventStreamController {

    private final EventLogService eventLog;

    public EventStreamController(EventLogService eventLog) {
        this.eventLog = eventLog;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(name = "decision_id", required = false) String decisionId,
                             @RequestParam(name = "event_type", required = false) EventType eventType) {
        SseEmitter emitter = new SseEmitter(0L);
        String subscriptionId = eventLog.subscribe(event -> {
            if (!matchesDecision(decisionId, event) || !matchesType(eventType, event)) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .id(event.eventId())
                    .name(event.eventType().name())
                    .data(event));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> eventLog.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> eventLog.unsubscribe(subscriptionId));
        emitter.onError(ex -> eventLog.unsubscribe(subscriptionId));
        return emitter;
    }

    private boolean matchesDecision(String decisionId, EventEnvelope event) {
        return decisionId == null || decisionId.equals(event.decisionId());
    }

    private boolean matchesType(EventType eventType, EventEnvelope event) {
        return eventType == null || eventType == event.eventType();
    }
}

package com.groupdispatch.dispatch.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * SSE stream of every dispatch event. Per-conversation streams live on
 * {@link ConversationController}.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventStreamController {

    private final SseStreamingService sseStreamingService;

    public EventStreamController(SseStreamingService sseStreamingService) {
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return sseStreamingService.createEmitter(null);
    }
}

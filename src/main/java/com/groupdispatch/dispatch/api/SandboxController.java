package com.groupdispatch.dispatch.api;

import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.core.queue.SandboxSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for live sandbox sessions.
 */
@RestController
@RequestMapping("/api/v1/sandboxes")
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final ConversationQueue queue;

    public SandboxController(ConversationQueue queue) {
        this.queue = queue;
    }

    /**
     * GET /api/v1/sandboxes: One entry per registered sandbox process.
     */
    @GetMapping
    public List<SandboxSession.Snapshot> listSandboxes() {
        log.debug("Listing live sandboxes");
        return queue.liveSessions();
    }
}

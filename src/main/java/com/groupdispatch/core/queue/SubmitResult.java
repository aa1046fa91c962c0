package com.groupdispatch.core.queue;

/**
 * Outcome of {@link ConversationQueue#submit}.
 */
public enum SubmitResult {
    /** Written to the stdin of the conversation's live sandbox. */
    PIPED,
    /** No live sandbox accepting input; the caller should enqueue a check instead. */
    NOT_RUNNING
}

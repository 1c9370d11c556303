package com.storyline.core.engine;

/**
 * Human decision attached to an escalation resolution.
 */
public enum Verdict {
    /** Accept the deliverable: complete the task and advance the story. */
    APPROVE,
    /** Reject the deliverable: fail the task. */
    REJECT,
    /** Record the answer; a task still in progress goes through the quality gate again. */
    NONE
}

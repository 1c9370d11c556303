package com.storyline.core.engine;

import com.storyline.core.model.DodResult;
import com.storyline.core.model.Task;

/**
 * Decides whether a task failed by the quality gate is re-enqueued automatically.
 */
@FunctionalInterface
public interface RetryPolicy {

    boolean shouldRetry(Task failedTask, DodResult result);
}

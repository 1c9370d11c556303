package com.storyline.worker;

/**
 * Hands an assigned task to the worker that owns its role.
 * <p>
 * Implementations must not block on the worker doing the work: the worker reports
 * completion later through its agent status record.
 */
public interface TaskDispatcher {

    /**
     * @return {@code true} if the worker side accepted the task, {@code false} to leave it
     *         for a later cycle
     */
    boolean dispatch(DispatchRequest request);
}

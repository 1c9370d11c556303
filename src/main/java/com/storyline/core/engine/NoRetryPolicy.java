package com.storyline.core.engine;

import com.storyline.core.model.DodResult;
import com.storyline.core.model.Task;
import org.springframework.stereotype.Component;

/**
 * Never retries. Failed tasks stay failed until re-enqueued by hand.
 */
@Component
public class NoRetryPolicy implements RetryPolicy {

    @Override
    public boolean shouldRetry(Task failedTask, DodResult result) {
        return false;
    }
}

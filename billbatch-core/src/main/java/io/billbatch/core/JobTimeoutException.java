package io.billbatch.core;

import java.time.Duration;

/**
 * Recorded on every item that had no outcome when its job ran out of time.
 */
public class JobTimeoutException extends RuntimeException {

    public JobTimeoutException(String jobId, Duration timeout) {
        super("Job " + jobId + " exceeded timeout of " + timeout);
    }
}

package com.arknoa.orchestrator.worker;

import java.time.Duration;

public class StageTimeoutException extends StageException {

    public StageTimeoutException(String stage, Duration timeout, Throwable cause) {
        super(Kind.TIMEOUT, "Stage '" + stage + "' did not answer within " + timeout, cause);
    }
}

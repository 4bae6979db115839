package com.eainde.verify.error;

public class RunCancelledException extends VerificationException {

    public RunCancelledException(String runId) {
        super("Run cancelled: " + runId);
    }
}

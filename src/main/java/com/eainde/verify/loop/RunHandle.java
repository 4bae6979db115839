package com.eainde.verify.loop;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-side view of an asynchronous run.
 */
public class RunHandle {

    private final RunState state;
    private final CompletableFuture<RunState> completion;

    RunHandle(RunState state, CompletableFuture<RunState> completion) {
        this.state = state;
        this.completion = completion;
    }

    public String runId() {
        return state.runId();
    }

    /**
     * Live state of the run; terminal once {@link #completion()} has completed.
     */
    public RunState state() {
        return state;
    }

    public CompletableFuture<RunState> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Requests cancellation. The run stops at its next phase boundary or while waiting for
     * claim results, and ends FAILED with {@link FailureKind#CANCELLED}.
     */
    public void cancel() {
        state.requestCancel();
    }

    public RunState await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId() + " ended abnormally", e.getCause());
        }
    }
}

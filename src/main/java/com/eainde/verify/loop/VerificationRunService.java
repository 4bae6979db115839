package com.eainde.verify.loop;

import com.eainde.verify.model.Artifact;
import com.eainde.verify.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for starting verification runs.
 * <p>
 * Generates run ids, creates the {@link RunState} and hands it to the {@link LoopController}.
 * Asynchronous runs execute on the run executor, fully independent of each other; their
 * handles stay available through {@link #handle(String)} until the run completes.
 * </p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * RunHandle handle = runService.start(Artifact.initial("api-doc", markdown), List.of("security"));
 * RunState finalState = handle.completion().join();
 * }</pre>
 */
@Log4j2
public class VerificationRunService {

    private final LoopController loopController;
    private final MdcAwareExecutor runExecutor;
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public VerificationRunService(LoopController loopController, MdcAwareExecutor runExecutor) {
        this.loopController = loopController;
        this.runExecutor = runExecutor;
    }

    public RunHandle start(Artifact artifact, List<String> domainIds) {
        return start(artifact, domainIds, loopController.settings().maxIterations());
    }

    /**
     * Starts a run asynchronously.
     *
     * @throws IllegalArgumentException if no domain is given or {@code maxIterations < 1}
     */
    public RunHandle start(Artifact artifact, List<String> domainIds, int maxIterations) {
        RunState state = RunState.start(newRunId(), artifact, domainIds, maxIterations);
        CompletableFuture<RunState> completion = new CompletableFuture<>();
        RunHandle handle = new RunHandle(state, completion);
        activeRuns.put(state.runId(), handle);

        log.info("Submitting run {} for artifact {} v{}", state.runId(), artifact.artifactId(), artifact.version());
        try {
            runExecutor.execute(() -> {
                RunState result;
                try {
                    result = loopController.run(state);
                } catch (RuntimeException | Error e) {
                    log.error("Run {} ended abnormally", state.runId(), e);
                    activeRuns.remove(state.runId());
                    completion.completeExceptionally(e);
                    return;
                }
                // Deregistered before completion is signalled.
                activeRuns.remove(state.runId());
                completion.complete(result);
            });
        } catch (RuntimeException e) {
            activeRuns.remove(state.runId());
            throw e;
        }
        return handle;
    }

    /**
     * Runs on the calling thread and returns the terminal state.
     */
    public RunState run(Artifact artifact, List<String> domainIds) {
        return run(artifact, domainIds, loopController.settings().maxIterations());
    }

    public RunState run(Artifact artifact, List<String> domainIds, int maxIterations) {
        return loopController.run(RunState.start(newRunId(), artifact, domainIds, maxIterations));
    }

    /**
     * Continues an existing run. Terminal states come back unchanged.
     */
    public RunState resume(RunState state) {
        return loopController.run(state);
    }

    public Optional<RunHandle> handle(String runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    /**
     * @return {@code false} if no active run has this id
     */
    public boolean cancel(String runId) {
        RunHandle handle = activeRuns.get(runId);
        if (handle == null) {
            return false;
        }
        log.info("Cancellation requested for run {}", runId);
        handle.cancel();
        return true;
    }

    public Set<String> activeRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }
}

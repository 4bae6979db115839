package com.eainde.verify.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = MdcAwareExecutor.fixed("mdc-test", 1);

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    @DisplayName("submitted tasks see the caller's MDC")
    void submitPropagates() throws Exception {
        MDC.put("runId", "run-7");
        MDC.put("iteration", "2");

        String seen = executor.submit(() -> MDC.get("runId") + "/" + MDC.get("iteration")).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("run-7/2");
    }

    @Test
    @DisplayName("executed tasks see the caller's MDC and leave the worker clean")
    void executePropagatesAndClears() throws Exception {
        MDC.put("runId", "run-8");
        CompletableFuture<String> first = new CompletableFuture<>();
        executor.execute(() -> first.complete(MDC.get("runId")));
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("run-8");

        MDC.clear();
        CompletableFuture<String> second = new CompletableFuture<>();
        executor.execute(() -> second.complete(String.valueOf(MDC.get("runId"))));

        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("null");
    }

    @Test
    @DisplayName("workers are named after the pool")
    void threadNames() throws Exception {
        String name = executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

        assertThat(name).startsWith("mdc-test-");
    }
}

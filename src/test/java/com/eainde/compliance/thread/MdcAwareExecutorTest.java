package com.eainde.compliance.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor(1, "test-worker");

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    @DisplayName("should propagate the caller's MDC to the worker")
    void propagates() {
        MDC.put("auditId", "audit-1");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("auditId"), executor).join();

        assertThat(seen).isEqualTo("audit-1");
    }

    @Test
    @DisplayName("should not leak one task's MDC into the next")
    void noLeak() {
        MDC.put("auditId", "audit-1");
        CompletableFuture.runAsync(() -> MDC.put("requirementId", "REQ-001"), executor).join();
        MDC.clear();

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("auditId") + "/" + MDC.get("requirementId"), executor)
                .join();

        assertThat(seen).isEqualTo("null/null");
    }

    @Test
    @DisplayName("should name worker threads with the configured prefix")
    void threadNames() {
        String name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor).join();

        assertThat(name).startsWith("test-worker-");
    }

    @Test
    @DisplayName("should reject a non-positive pool size")
    void rejectsZero() {
        assertThatThrownBy(() -> new MdcAwareExecutor(0, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}

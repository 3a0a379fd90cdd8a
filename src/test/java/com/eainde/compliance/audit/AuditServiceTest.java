package com.eainde.compliance.audit;

import com.eainde.compliance.document.DocumentSource;
import com.eainde.compliance.model.Verdict;
import com.eainde.compliance.orchestration.AuditOrchestrator;
import com.eainde.compliance.orchestration.OrchestrationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T10:00:00Z"), ZoneOffset.UTC);
    private static final DocumentSource SOURCE = DocumentSource.ofText("policy.txt", "We collect data.");

    @Mock private AuditOrchestrator orchestrator;

    private InMemoryAuditRepository repository;
    private AuditService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditRepository();
        service = new AuditService(orchestrator, repository, Runnable::run, CLOCK);
    }

    @Test
    @DisplayName("should create a PENDING audit with a unique id")
    void submit() {
        AuditRecord first = service.submit("policy.txt");
        AuditRecord second = service.submit("policy.txt");

        assertThat(first.getId()).isNotEqualTo(second.getId());
        AuditStatusView status = service.status(first.getId());
        assertThat(status.status()).isEqualTo(AuditStatus.PENDING);
        assertThat(status.progress()).isZero();
        assertThat(status.createdAt()).isEqualTo("2026-06-01T10:00:00Z");
        assertThat(service.report(first.getId())).isEmpty();
    }

    @Test
    @DisplayName("should expose the report once the run completes")
    void start() {
        AuditRecord audit = service.submit("policy.txt");
        OrchestrationResult result = new OrchestrationResult(audit.getId(), List.of(), Verdict.YELLOW, null, null);
        when(orchestrator.run(anyString(), any(DocumentSource.class))).thenAnswer(invocation -> {
            audit.transitionTo(AuditStatus.EXTRACTING, 0.1);
            audit.transitionTo(AuditStatus.ANALYZING, 0.4);
            audit.complete(result);
            return audit;
        });

        AuditRecord finished = service.start(audit.getId(), SOURCE).join();

        assertThat(finished.getStatus()).isEqualTo(AuditStatus.COMPLETED);
        assertThat(service.status(audit.getId()).progress()).isEqualTo(1.0);
        assertThat(service.report(audit.getId())).contains(result);
    }

    @Test
    @DisplayName("should reject unknown audit ids")
    void unknown() {
        assertThatThrownBy(() -> service.status("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Audit not found: missing");
        assertThatThrownBy(() -> service.report("missing")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.start("missing", SOURCE)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(orchestrator);
    }
}

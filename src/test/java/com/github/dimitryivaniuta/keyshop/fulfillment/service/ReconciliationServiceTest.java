package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.config.ReconciliationConfig;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningClient;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.RemoteExistence;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.CredentialRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.ReconciliationReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.ReconciliationReport.Transition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;

/**
 * Transition table of the reconciliation loop, against a mocked panel and mocked transactions.
 */
class ReconciliationServiceTest {

    private static final Instant T0 = Instant.parse("2026-10-01T12:00:00Z");

    private final CredentialRepository repository = Mockito.mock(CredentialRepository.class);
    private final ProvisioningClient client = Mockito.mock(ProvisioningClient.class);
    private final ReconciliationTxService tx = Mockito.mock(ReconciliationTxService.class);
    private final MutableClock clock = new MutableClock(T0);

    private ThreadPoolTaskExecutor executor;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        AppProperties props = new AppProperties();
        props.getReconciliation().setFanOut(2);
        props.getReconciliation().setCheckTimeout(Duration.ofSeconds(5));
        executor = new ReconciliationConfig().reconciliationExecutor(props);
        service = new ReconciliationService(repository, client, tx, props, clock, new SimpleMeterRegistry(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void failedCheckChangesNothing() {
        Credential c = credential(1L, null);

        Assertions.assertEquals(Transition.UNKNOWN, service.apply(c, RemoteExistence.UNKNOWN));
        Mockito.verifyNoInteractions(tx);
    }

    @Test
    void firstAbsenceOnlyMarksMissing() {
        Credential c = credential(1L, null);
        Mockito.when(tx.markMissing(1L, T0)).thenReturn(true);

        Assertions.assertEquals(Transition.MARKED_MISSING, service.apply(c, RemoteExistence.ABSENT));
        Mockito.verify(tx, Mockito.never()).deleteIfUnchanged(anyLong(), any(), any());
    }

    @Test
    void absenceInsideGraceWindowIsSkipped() {
        Credential c = credential(1L, T0);
        clock.advance(Duration.ofHours(23));

        Assertions.assertEquals(Transition.SKIPPED, service.apply(c, RemoteExistence.ABSENT));
        Mockito.verifyNoInteractions(tx);
    }

    @Test
    void absenceAfterGraceWindowIsConfirmedThenDeleted() {
        Credential c = credential(1L, T0);
        clock.advance(Duration.ofHours(25));
        Mockito.when(client.exists("nl-1", "u1", "uuid-1")).thenReturn(RemoteExistence.ABSENT);
        Mockito.when(tx.deleteIfUnchanged(1L, T0, c.getExpiresAt())).thenReturn(true);

        Assertions.assertEquals(Transition.DELETED, service.apply(c, RemoteExistence.ABSENT));
    }

    @Test
    void reappearanceDuringConfirmationClearsInsteadOfDeleting() {
        Credential c = credential(1L, T0);
        clock.advance(Duration.ofHours(25));
        Mockito.when(client.exists("nl-1", "u1", "uuid-1")).thenReturn(RemoteExistence.PRESENT);
        Mockito.when(tx.clearMissing(1L)).thenReturn(true);

        Assertions.assertEquals(Transition.CLEARED, service.apply(c, RemoteExistence.ABSENT));
        Mockito.verify(tx, Mockito.never()).deleteIfUnchanged(anyLong(), any(), any());
    }

    @Test
    void concurrentExtensionPreventsDelete() {
        Credential c = credential(1L, T0);
        clock.advance(Duration.ofHours(25));
        Mockito.when(client.exists("nl-1", "u1", "uuid-1")).thenReturn(RemoteExistence.ABSENT);
        Mockito.when(tx.deleteIfUnchanged(anyLong(), any(), any())).thenReturn(false);

        Assertions.assertEquals(Transition.SKIPPED, service.apply(c, RemoteExistence.ABSENT));
    }

    @Test
    void ownerPassCountsEveryTransitionAndSurvivesClientErrors() {
        Credential present = credential(1L, null);
        Credential broken = credential(2L, null);
        broken.setUniqueIdentity("u2");
        Mockito.when(repository.findByOwnerIdOrderById(9L)).thenReturn(List.of(present, broken));
        Mockito.when(client.exists("nl-1", "u1", "uuid-1")).thenReturn(RemoteExistence.PRESENT);
        Mockito.when(client.exists("nl-1", "u2", "uuid-1")).thenThrow(new IllegalStateException("panel down"));

        ReconciliationReport report = service.reconcileOwner(9L);

        Assertions.assertEquals(2, report.checked());
        Assertions.assertEquals(1, report.present());
        Assertions.assertEquals(1, report.unknown());
        Assertions.assertEquals(0, report.deleted());
    }

    @Test
    void remoteChecksRunOnReconciliationPool() {
        Credential present = credential(1L, null);
        Mockito.when(repository.findByOwnerIdOrderById(9L)).thenReturn(List.of(present));
        Set<String> threads = ConcurrentHashMap.newKeySet();
        Mockito.when(client.exists("nl-1", "u1", "uuid-1")).thenAnswer(inv -> {
            threads.add(Thread.currentThread().getName());
            return RemoteExistence.PRESENT;
        });

        service.reconcileOwner(9L);

        Assertions.assertEquals(1, threads.size());
        Assertions.assertTrue(threads.iterator().next().startsWith("reconcile-"));
    }

    private static Credential credential(long id, Instant missingSince) {
        Credential c = Credential.provisioned(9L, "nl-1", "uuid-1", "u" + id, T0.plus(Duration.ofDays(30)), null, T0);
        c.setId(id);
        c.setMissingSince(missingSince);
        return c;
    }
}

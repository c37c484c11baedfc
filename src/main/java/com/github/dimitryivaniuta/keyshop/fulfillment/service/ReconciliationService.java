package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import static com.github.dimitryivaniuta.keyshop.fulfillment.config.ReconciliationConfig.RECONCILIATION_EXECUTOR;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningClient;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.RemoteExistence;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.CredentialRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.ReconciliationReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.ReconciliationReport.Transition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Keeps local credentials in line with the panels, without ever deleting on a single bad answer.
 *
 * <p>Per credential: present clears the missing mark; the first "absent" only sets {@code missing_since}; a
 * credential still absent once the grace window has passed is checked once more and then deleted, unless an
 * extension touched it in the meantime. Failed checks change nothing.</p>
 *
 * <p>Remote checks run on a bounded pool outside any transaction; each state change is its own short
 * transaction.</p>
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private static final int PAGE = 200;

    private final CredentialRepository credentialRepository;
    private final ProvisioningClient provisioningClient;
    private final ReconciliationTxService txService;
    private final Clock clock;
    private final Duration graceWindow;
    private final Duration checkTimeout;
    private final Executor executor;
    private final Map<Transition, Counter> counters = new EnumMap<>(Transition.class);

    public ReconciliationService(
            CredentialRepository credentialRepository,
            ProvisioningClient provisioningClient,
            ReconciliationTxService txService,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry,
            @Qualifier(RECONCILIATION_EXECUTOR) Executor executor
    ) {
        this.credentialRepository = credentialRepository;
        this.provisioningClient = provisioningClient;
        this.txService = txService;
        this.clock = clock;
        this.graceWindow = properties.getReconciliation().getGraceWindow();
        this.checkTimeout = properties.getReconciliation().getCheckTimeout();

        this.executor = executor;

        for (Transition t : Transition.values()) {
            counters.put(t, Counter.builder("keyshop.reconciliation.credentials")
                    .tag("transition", t.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
    }

    /**
     * Reconciles one owner's credentials.
     *
     * @param ownerId owner
     * @return counters of the pass
     */
    public ReconciliationReport reconcileOwner(long ownerId) {
        ReconciliationReport report = reconcile(credentialRepository.findByOwnerIdOrderById(ownerId));
        log.info("Reconciled owner={} report={}", ownerId, report);
        return report;
    }

    /**
     * Reconciles every credential, page by page.
     *
     * @return counters of the pass
     */
    public ReconciliationReport reconcileAll() {
        List<Long> ids = credentialRepository.findAllIds();
        ReconciliationReport total = ReconciliationReport.empty();
        for (int from = 0; from < ids.size(); from += PAGE) {
            List<Long> page = ids.subList(from, Math.min(ids.size(), from + PAGE));
            total = merge(total, reconcile(credentialRepository.findAllById(page)));
        }
        log.info("Reconciliation sweep done report={}", total);
        return total;
    }

    private ReconciliationReport reconcile(List<Credential> credentials) {
        List<CompletableFuture<RemoteExistence>> checks = new ArrayList<>(credentials.size());
        for (Credential c : credentials) {
            checks.add(check(c));
        }

        ReconciliationReport report = ReconciliationReport.empty();
        for (int i = 0; i < credentials.size(); i++) {
            Credential c = credentials.get(i);
            Transition t;
            try {
                t = apply(c, checks.get(i).join());
            } catch (RuntimeException e) {
                log.warn("Reconciliation of credential {} failed: {}", c.getId(), e.getMessage(), e);
                t = Transition.UNKNOWN;
            }
            counters.get(t).increment();
            report = report.plus(t);
        }
        return report;
    }

    private CompletableFuture<RemoteExistence> check(Credential c) {
        return CompletableFuture
                .supplyAsync(() -> provisioningClient.exists(c.getProviderHost(), c.getUniqueIdentity(), c.getRemoteUuid()),
                        executor)
                .orTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("Existence check failed credential={} error={}", c.getId(), e.getMessage());
                    return RemoteExistence.UNKNOWN;
                });
    }

    /**
     * State transition of one credential given its remote existence.
     */
    Transition apply(Credential c, RemoteExistence existence) {
        Instant now = clock.instant();
        return switch (existence) {
            case UNKNOWN -> Transition.UNKNOWN;
            case PRESENT -> txService.clearMissing(c.getId()) ? Transition.CLEARED : Transition.PRESENT;
            case ABSENT -> {
                if (c.getMissingSince() == null) {
                    yield txService.markMissing(c.getId(), now) ? Transition.MARKED_MISSING : Transition.SKIPPED;
                }
                if (c.getMissingSince().plus(graceWindow).isAfter(now)) {
                    yield Transition.SKIPPED;
                }
                yield confirmAndDelete(c);
            }
        };
    }

    private Transition confirmAndDelete(Credential c) {
        RemoteExistence again = check(c).join();
        switch (again) {
            case PRESENT:
                return txService.clearMissing(c.getId()) ? Transition.CLEARED : Transition.PRESENT;
            case UNKNOWN:
                return Transition.UNKNOWN;
            default:
                break;
        }
        if (txService.deleteIfUnchanged(c.getId(), c.getMissingSince(), c.getExpiresAt())) {
            log.info("Credential deleted after grace window id={} owner={} missingSince={}",
                    c.getId(), c.getOwnerId(), c.getMissingSince());
            return Transition.DELETED;
        }
        log.info("Credential changed during reconciliation, kept id={}", c.getId());
        return Transition.SKIPPED;
    }

    private static ReconciliationReport merge(ReconciliationReport a, ReconciliationReport b) {
        return new ReconciliationReport(
                a.checked() + b.checked(),
                a.present() + b.present(),
                a.markedMissing() + b.markedMissing(),
                a.cleared() + b.cleared(),
                a.deleted() + b.deleted(),
                a.unknown() + b.unknown(),
                a.skipped() + b.skipped()
        );
    }
}

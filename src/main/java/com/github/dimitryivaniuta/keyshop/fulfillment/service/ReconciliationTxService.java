package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import static com.github.dimitryivaniuta.keyshop.fulfillment.service.PostgresAdvisoryLockService.CREDENTIAL_SCOPE;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.CredentialRepository;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Short transactions for {@link ReconciliationService}. Reconciliation writes nothing but
 * {@code missing_since}, except for the final delete.
 */
@Service
public class ReconciliationTxService {

    private final CredentialRepository repository;
    private final PostgresAdvisoryLockService advisoryLockService;

    public ReconciliationTxService(CredentialRepository repository, PostgresAdvisoryLockService advisoryLockService) {
        this.repository = repository;
        this.advisoryLockService = advisoryLockService;
    }

    /**
     * @return true when a missing mark was cleared
     */
    @Transactional
    public boolean clearMissing(long credentialId) {
        return repository.clearMissing(credentialId) == 1;
    }

    /**
     * @return true when this was the first missing observation
     */
    @Transactional
    public boolean markMissing(long credentialId, Instant now) {
        return repository.markMissing(credentialId, now) == 1;
    }

    /**
     * Deletes a credential unless it changed since it was observed missing.
     *
     * @param credentialId      credential
     * @param observedMissing   {@code missing_since} seen when the pass started
     * @param observedExpiresAt {@code expires_at} seen when the pass started
     * @return true when deleted; false when it is gone or was extended or cleared meanwhile
     */
    @Transactional
    public boolean deleteIfUnchanged(long credentialId, Instant observedMissing, Instant observedExpiresAt) {
        advisoryLockService.lock(CREDENTIAL_SCOPE, String.valueOf(credentialId));

        Optional<Credential> fresh = repository.findById(credentialId);
        if (fresh.isEmpty()) {
            return false;
        }
        Credential c = fresh.get();
        if (c.getMissingSince() == null
                || !Objects.equals(c.getMissingSince(), observedMissing)
                || !Objects.equals(c.getExpiresAt(), observedExpiresAt)) {
            return false;
        }
        repository.delete(c);
        return true;
    }
}

package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import static com.github.dimitryivaniuta.keyshop.fulfillment.service.PostgresAdvisoryLockService.CREDENTIAL_SCOPE;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.CredentialOrigin;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OriginSource;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Plan;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisionedCredential;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningClient;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningException;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningRequest;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.AccountRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.CredentialRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Credential lifecycle: issue, trial, extend, host switch and operator delete. Remote call first, then a
 * short local transaction.
 *
 * <p>Local writes to an existing credential hold the {@code ("credential", id)} advisory lock and re-read the
 * row, so an extension, a host switch and a reconciliation delete of the same credential never interleave.
 * When the local write fails after the panel already accepted a new key, the key is deleted on the panel
 * again.</p>
 */
@Slf4j
@Service
public class CredentialService {

    private static final int IDENTITY_ATTEMPTS = 3;

    private final CredentialRepository repository;
    private final AccountRepository accountRepository;
    private final ProvisioningClient provisioningClient;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final AppProperties properties;
    private final TransactionTemplate tx;
    private final Clock clock;

    public CredentialService(
            CredentialRepository repository,
            AccountRepository accountRepository,
            ProvisioningClient provisioningClient,
            PostgresAdvisoryLockService advisoryLockService,
            AppProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.repository = repository;
        this.accountRepository = accountRepository;
        this.provisioningClient = provisioningClient;
        this.advisoryLockService = advisoryLockService;
        this.properties = properties;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public List<Credential> listFor(long ownerId) {
        return repository.findByOwnerIdOrderById(ownerId);
    }

    /**
     * Provisions a new credential and stores it.
     *
     * @param ownerId           owner of the new credential
     * @param host              panel host
     * @param requestedIdentity handle chosen by the payer, or {@code null} to generate one
     * @param days              days to grant
     * @param plan              plan supplying traffic/device limits, may be {@code null}
     * @param origin            origin note
     * @return stored credential
     * @throws ProvisioningException when the panel rejects the request or times out, or the key could not be
     *                               stored locally
     */
    public Credential issue(long ownerId, String host, String requestedIdentity, int days, Plan plan,
                            CredentialOrigin origin) throws ProvisioningException {
        String identity = requestedIdentity != null
                ? Credential.normalizeIdentity(requestedIdentity)
                : newIdentity(ownerId);
        if (requestedIdentity != null && repository.existsByUniqueIdentity(identity)) {
            throw ProvisioningException.identityTaken(identity);
        }

        ProvisioningRequest request = new ProvisioningRequest(
                host,
                identity,
                null,
                clock.instant().plus(Duration.ofDays(days)),
                plan != null ? plan.getTrafficLimitBytes() : null,
                plan != null ? plan.getDeviceLimit() : null
        );
        return provisionAndStore(ownerId, request, origin);
    }

    /**
     * Issues the owner's one free trial key.
     *
     * <p>The trial is claimed before the panel is called and given back when provisioning fails, so two
     * concurrent requests never both get a key.</p>
     *
     * @param ownerId owner
     * @param host    panel host
     * @return stored trial credential
     * @throws TrialUnavailableException when trials are off or this owner already had one
     * @throws ProvisioningException     when the panel rejects the request or times out
     */
    public Credential issueTrial(long ownerId, String host) throws ProvisioningException {
        AppProperties.Fulfillment f = properties.getFulfillment();
        if (!f.isTrialEnabled()) {
            throw new TrialUnavailableException(ownerId, "trials are disabled");
        }
        Integer claimed = tx.execute(status -> accountRepository.claimTrial(ownerId, clock.instant()));
        if (claimed == null || claimed == 0) {
            throw new TrialUnavailableException(ownerId, "already used");
        }

        ProvisioningRequest request = new ProvisioningRequest(
                host,
                newIdentity(ownerId),
                null,
                clock.instant().plus(Duration.ofDays(f.getTrialDays())),
                f.getTrialTrafficLimitBytes(),
                f.getTrialDeviceLimit()
        );
        try {
            return provisionAndStore(ownerId, request,
                    CredentialOrigin.of(OriginSource.TRIAL, null, null, f.getTrialDays()));
        } catch (ProvisioningException | RuntimeException e) {
            tx.executeWithoutResult(status -> accountRepository.releaseTrial(ownerId, clock.instant()));
            log.warn("Trial for owner={} not issued, claim released: {}", ownerId, e.getMessage());
            throw e;
        }
    }

    /**
     * Extends one of the owner's credentials by {@code days}, counted from its expiry or from now, whichever
     * is later.
     *
     * @param ownerId      owner; must own the credential
     * @param credentialId credential to extend
     * @param days         days to add
     * @param origin       origin note of the extension
     * @return updated credential
     * @throws ProvisioningException when the credential is unknown, or the panel rejects or times out
     */
    public Credential extend(long ownerId, long credentialId, int days, CredentialOrigin origin)
            throws ProvisioningException {
        Credential current = owned(ownerId, credentialId);

        Instant now = clock.instant();
        Instant base = current.getExpiresAt().isAfter(now) ? current.getExpiresAt() : now;
        ProvisioningRequest request = new ProvisioningRequest(
                current.getProviderHost(),
                current.getUniqueIdentity(),
                current.getRemoteUuid(),
                base.plus(Duration.ofDays(days)),
                current.getTrafficLimitBytes(),
                current.getDeviceLimit()
        );
        ProvisionedCredential remote = provisioningClient.createOrExtend(request);
        Instant expiry = remote.expiresAt() != null ? remote.expiresAt() : request.expiresAt();

        Credential saved = tx.execute(status -> {
            advisoryLockService.lock(CREDENTIAL_SCOPE, String.valueOf(credentialId));
            Credential c = repository.findById(credentialId).orElseGet(() -> {
                log.warn("Credential {} vanished during extension, re-creating it", credentialId);
                return Credential.provisioned(ownerId, remote.host(), remote.remoteUuid(),
                        current.getUniqueIdentity(), expiry, origin, clock.instant());
            });
            if (c.getProviderHost() != null && !c.getProviderHost().equalsIgnoreCase(request.host())) {
                // moved to another host meanwhile: keep its new location
                c.extendTo(expiry, null, null, origin, clock.instant());
                return repository.save(c);
            }
            c.extendTo(expiry, remote.remoteUuid(), remote.host(), origin, clock.instant());
            if (remote.connectionInfo() != null) {
                c.setConnectionInfo(remote.connectionInfo());
            }
            return repository.save(c);
        });
        if (!saved.getProviderHost().equalsIgnoreCase(request.host())) {
            resync(saved);
        }
        log.info("Credential extended id={} owner={} expiresAt={}", saved.getId(), ownerId, expiry);
        return saved;
    }

    /**
     * Moves a credential to another panel host, keeping its handle, expiry and limits.
     *
     * <p>The key is created on the new host first. Only after the local row points at the new host is the
     * old remote key deleted; that delete is best effort and a leftover is logged.</p>
     *
     * @param ownerId      owner; must own the credential
     * @param credentialId credential to move
     * @param newHost      target host
     * @return updated credential
     * @throws ProvisioningException when the credential is unknown or gone, or the new host rejects or times out
     */
    public Credential switchHost(long ownerId, long credentialId, String newHost) throws ProvisioningException {
        Credential current = owned(ownerId, credentialId);
        String oldHost = current.getProviderHost();
        if (oldHost.equalsIgnoreCase(newHost)) {
            return current;
        }

        ProvisioningRequest request = new ProvisioningRequest(
                newHost,
                current.getUniqueIdentity(),
                null,
                current.getExpiresAt(),
                current.getTrafficLimitBytes(),
                current.getDeviceLimit()
        );
        ProvisionedCredential remote = provisioningClient.createOrExtend(request);

        Optional<Credential> moved;
        try {
            moved = Optional.ofNullable(tx.execute(status -> {
                advisoryLockService.lock(CREDENTIAL_SCOPE, String.valueOf(credentialId));
                return repository.findById(credentialId)
                        .map(c -> {
                            c.moveTo(remote.host() != null ? remote.host() : newHost, remote.remoteUuid(),
                                    remote.connectionInfo(), clock.instant());
                            return repository.save(c);
                        })
                        .orElse(null);
            }));
        } catch (DataAccessException e) {
            compensate(remote, "host switch of credential " + credentialId);
            throw e;
        }
        if (moved.isEmpty()) {
            compensate(remote, "host switch of vanished credential " + credentialId);
            throw ProvisioningException.invalidOrder("Credential " + credentialId + " was deleted during host switch");
        }

        Credential saved = moved.get();
        if (!saved.getExpiresAt().equals(request.expiresAt())) {
            // extended on the old host while the new key was being created
            resync(saved);
        }
        deleteRemoteQuietly(oldHost, current.getUniqueIdentity(), "old host after switch of credential " + credentialId);
        log.info("Credential moved id={} owner={} from={} to={}", credentialId, ownerId, oldHost, saved.getProviderHost());
        return saved;
    }

    /**
     * Operator delete: removes the key on the panel (best effort), then the local row under the credential lock.
     *
     * @param credentialId credential
     * @return true when a local row was deleted
     */
    public boolean deleteByOperator(long credentialId) {
        Optional<Credential> current = repository.findById(credentialId);
        if (current.isEmpty()) {
            return false;
        }
        Credential c = current.get();
        deleteRemoteQuietly(c.getProviderHost(), c.getUniqueIdentity(), "operator delete of credential " + credentialId);

        Boolean deleted = tx.execute(status -> {
            advisoryLockService.lock(CREDENTIAL_SCOPE, String.valueOf(credentialId));
            return repository.findById(credentialId)
                    .map(fresh -> {
                        repository.delete(fresh);
                        return true;
                    })
                    .orElse(false);
        });
        log.info("Credential deleted by operator id={} owner={} host={} deleted={}",
                credentialId, c.getOwnerId(), c.getProviderHost(), deleted);
        return Boolean.TRUE.equals(deleted);
    }

    private Credential provisionAndStore(long ownerId, ProvisioningRequest request, CredentialOrigin origin)
            throws ProvisioningException {
        ProvisionedCredential remote = provisioningClient.createOrExtend(request);
        Instant expiry = remote.expiresAt() != null ? remote.expiresAt() : request.expiresAt();

        try {
            Credential saved = tx.execute(status -> {
                Credential c = Credential.provisioned(ownerId, remote.host(), remote.remoteUuid(), remote.identity(),
                        expiry, origin, clock.instant());
                c.setTrafficLimitBytes(request.trafficLimitBytes());
                c.setDeviceLimit(request.deviceLimit());
                c.setConnectionInfo(remote.connectionInfo());
                return repository.save(c);
            });
            log.info("Credential issued id={} owner={} host={} expiresAt={} source={}",
                    saved.getId(), ownerId, request.host(), expiry, origin.getSource());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.error("Credential provisioned remotely but not stored owner={} host={} identity={}",
                    ownerId, request.host(), request.identity(), e);
            compensate(remote, "unstored credential of owner " + ownerId);
            throw new ProvisioningException("Identity already exists locally: " + request.identity(), 409, false, e);
        } catch (DataAccessException e) {
            log.error("Credential provisioned remotely but not stored owner={} host={} identity={}",
                    ownerId, request.host(), request.identity(), e);
            compensate(remote, "unstored credential of owner " + ownerId);
            throw new ProvisioningException("Credential could not be stored: " + request.identity(), null, false, e);
        }
    }

    private void compensate(ProvisionedCredential remote, String context) {
        deleteRemoteQuietly(remote.host(), remote.identity(), context);
    }

    private void deleteRemoteQuietly(String host, String identity, String context) {
        try {
            if (provisioningClient.delete(host, identity)) {
                log.info("Remote key deleted host={} identity={} ({})", host, identity, context);
            } else {
                log.error("Remote key NOT deleted host={} identity={} ({}); remove it on the panel", host, identity, context);
            }
        } catch (RuntimeException e) {
            log.error("Remote key delete failed host={} identity={} ({}); remove it on the panel", host, identity, context, e);
        }
    }

    private void resync(Credential c) {
        ProvisioningRequest request = new ProvisioningRequest(c.getProviderHost(), c.getUniqueIdentity(),
                c.getRemoteUuid(), c.getExpiresAt(), c.getTrafficLimitBytes(), c.getDeviceLimit());
        try {
            provisioningClient.createOrExtend(request);
        } catch (ProvisioningException e) {
            log.error("Expiry of credential {} not pushed to {}: {}; reconcile it manually",
                    c.getId(), c.getProviderHost(), e.getMessage());
        }
    }

    private Credential owned(long ownerId, long credentialId) throws ProvisioningException {
        return repository.findById(credentialId)
                .filter(c -> c.getOwnerId() == ownerId)
                .orElseThrow(() -> ProvisioningException.invalidOrder(
                        "Credential " + credentialId + " not found for owner " + ownerId));
    }

    private String newIdentity(long ownerId) {
        for (int i = 0; i < IDENTITY_ATTEMPTS; i++) {
            String candidate = "u" + ownerId + "-" + UUID.randomUUID().toString().substring(0, 8);
            if (!repository.existsByUniqueIdentity(candidate)) {
                return candidate;
            }
        }
        return "u" + ownerId + "-" + UUID.randomUUID();
    }
}

package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An access key provisioned on an external panel host.
 *
 * <p>{@code missingSince} is owned by reconciliation: it is non-null only while the remote panel is believed
 * not to have this credential.</p>
 */
@Entity
@Table(
        name = "credentials",
        indexes = {
                @Index(name = "idx_credentials_owner", columnList = "owner_id"),
                @Index(name = "uq_credentials_identity", columnList = "unique_identity", unique = true),
                @Index(name = "idx_credentials_missing_since", columnList = "missing_since")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Credential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "provider_host", nullable = false, length = 128)
    private String providerHost;

    @Column(name = "remote_uuid", length = 64)
    private String remoteUuid;

    @Column(name = "unique_identity", nullable = false, length = 255)
    private String uniqueIdentity;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "missing_since")
    private Instant missingSince;

    @Column(name = "traffic_limit_bytes")
    private Long trafficLimitBytes;

    @Column(name = "device_limit")
    private Integer deviceLimit;

    @Column(name = "connection_info", columnDefinition = "text")
    private String connectionInfo;

    @Embedded
    private CredentialOrigin origin;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a credential for a freshly provisioned remote user.
     *
     * @param ownerId        owner
     * @param providerHost   panel host name
     * @param remoteUuid     remote user uuid
     * @param uniqueIdentity globally unique handle, stored lower-cased
     * @param expiresAt      expiry reported by the panel
     * @param origin         origin note
     * @param now            creation time
     * @return new, unsaved credential
     */
    public static Credential provisioned(Long ownerId, String providerHost, String remoteUuid, String uniqueIdentity,
                                         Instant expiresAt, CredentialOrigin origin, Instant now) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(uniqueIdentity, "uniqueIdentity");
        Credential c = new Credential();
        c.ownerId = ownerId;
        c.providerHost = providerHost;
        c.remoteUuid = remoteUuid;
        c.uniqueIdentity = normalizeIdentity(uniqueIdentity);
        c.expiresAt = expiresAt;
        c.origin = origin;
        c.createdAt = now;
        c.updatedAt = now;
        return c;
    }

    /**
     * Applies a successful remote extension.
     *
     * @param newExpiry  expiry reported by the panel
     * @param remoteUuid remote uuid (may change when the key moves host)
     * @param host       host the key now lives on
     * @param origin     origin note of the extension
     * @param now        update time
     */
    public void extendTo(Instant newExpiry, String remoteUuid, String host, CredentialOrigin origin, Instant now) {
        this.expiresAt = newExpiry;
        if (remoteUuid != null) {
            this.remoteUuid = remoteUuid;
        }
        if (host != null) {
            this.providerHost = host;
        }
        this.origin = origin;
        this.missingSince = null;
        this.updatedAt = now;
    }

    /**
     * Records that the key now lives on another panel host. Expiry and limits are unchanged.
     *
     * @param host           new host
     * @param remoteUuid     uuid assigned by the new host
     * @param connectionInfo connection string issued by the new host, kept when {@code null}
     * @param now            update time
     */
    public void moveTo(String host, String remoteUuid, String connectionInfo, Instant now) {
        this.providerHost = Objects.requireNonNull(host, "host");
        this.remoteUuid = remoteUuid;
        if (connectionInfo != null) {
            this.connectionInfo = connectionInfo;
        }
        this.missingSince = null;
        this.updatedAt = now;
    }

    /**
     * Lower-cases and trims a credential handle.
     *
     * @param identity raw handle
     * @return normalized handle
     */
    public static String normalizeIdentity(String identity) {
        return identity == null ? null : identity.trim().toLowerCase(Locale.ROOT);
    }
}

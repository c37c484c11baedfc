package com.github.dimitryivaniuta.keyshop.fulfillment.provisioning;

import java.time.Instant;

/**
 * Create-or-extend request sent to a panel host.
 *
 * @param host              panel host name
 * @param identity          unique credential handle
 * @param remoteUuid        existing remote uuid when extending, {@code null} for a new credential
 * @param expiresAt         expiry the panel should set
 * @param trafficLimitBytes traffic cap, {@code null} for unlimited
 * @param deviceLimit       device cap, {@code null} for unlimited
 */
public record ProvisioningRequest(
        String host,
        String identity,
        String remoteUuid,
        Instant expiresAt,
        Long trafficLimitBytes,
        Integer deviceLimit
) {
}

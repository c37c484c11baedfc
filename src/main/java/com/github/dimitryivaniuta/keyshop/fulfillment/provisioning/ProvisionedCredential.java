package com.github.dimitryivaniuta.keyshop.fulfillment.provisioning;

import java.time.Instant;

/**
 * What the panel reports after a successful create-or-extend.
 *
 * @param host           host the credential lives on
 * @param identity       credential handle
 * @param remoteUuid     remote user uuid
 * @param expiresAt      expiry as stored by the panel
 * @param connectionInfo connection string handed to the payer
 */
public record ProvisionedCredential(
        String host,
        String identity,
        String remoteUuid,
        Instant expiresAt,
        String connectionInfo
) {
}

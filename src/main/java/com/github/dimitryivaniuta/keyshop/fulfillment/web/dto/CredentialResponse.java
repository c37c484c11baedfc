package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OriginSource;
import java.time.Instant;

public record CredentialResponse(
        long id,
        long ownerId,
        String host,
        String identity,
        Instant expiresAt,
        Instant missingSince,
        String connectionInfo,
        OriginSource source,
        String label
) {

    public static CredentialResponse from(Credential c) {
        return new CredentialResponse(
                c.getId(),
                c.getOwnerId(),
                c.getProviderHost(),
                c.getUniqueIdentity(),
                c.getExpiresAt(),
                c.getMissingSince(),
                c.getConnectionInfo(),
                c.getOrigin() != null ? c.getOrigin().getSource() : null,
                c.getOrigin() != null ? c.getOrigin().getLabel() : null
        );
    }
}

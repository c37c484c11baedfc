package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningErrorCode;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ProvisioningErrorClassifierTest {

    private final ProvisioningErrorClassifier classifier = new ProvisioningErrorClassifier();

    @Test
    void timeoutsAreRecognisedByFlagAndByText() {
        Assertions.assertEquals(ProvisioningErrorCode.TIMEOUT,
                classifier.classify(ProvisioningException.timedOut("read", new SocketTimeoutException())));
        Assertions.assertEquals(ProvisioningErrorCode.TIMEOUT,
                classifier.classify(ProvisioningException.rejected(502, "Gateway: upstream timed out")));
    }

    @Test
    void conflictsMeanIdentityTaken() {
        Assertions.assertEquals(ProvisioningErrorCode.IDENTITY_TAKEN,
                classifier.classify(ProvisioningException.rejected(409, "conflict")));
        Assertions.assertEquals(ProvisioningErrorCode.IDENTITY_TAKEN,
                classifier.classify(ProvisioningException.rejected(400, "User already exists")));
    }

    @Test
    void missingHostIsRecognised() {
        Assertions.assertEquals(ProvisioningErrorCode.HOST_NOT_FOUND,
                classifier.classify(ProvisioningException.rejected(404, "host nl-9 is not configured")));
        Assertions.assertEquals(ProvisioningErrorCode.HOST_NOT_FOUND,
                classifier.classify(ProvisioningException.rejected(500, "Unknown host")));
    }

    @Test
    void explicitCodeWinsOverText() {
        Assertions.assertEquals(ProvisioningErrorCode.INVALID_ORDER,
                classifier.classify(ProvisioningException.invalidOrder("No duration, request timed out")));
    }

    @Test
    void everythingElseIsUpstreamError() {
        Assertions.assertEquals(ProvisioningErrorCode.UPSTREAM_ERROR,
                classifier.classify(ProvisioningException.rejected(500, "internal error")));
        Assertions.assertEquals(ProvisioningErrorCode.UPSTREAM_ERROR,
                classifier.classify(new ProvisioningException(null, null, false, null)));
    }
}

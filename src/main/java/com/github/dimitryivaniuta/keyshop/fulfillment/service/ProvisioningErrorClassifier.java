package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningErrorCode;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningException;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps a provisioning failure to the code shown to the payer.
 */
@Component
public class ProvisioningErrorClassifier {

    public ProvisioningErrorCode classify(ProvisioningException e) {
        if (e.getCode() != null) {
            return e.getCode();
        }
        if (e.isTimeout()) {
            return ProvisioningErrorCode.TIMEOUT;
        }
        String detail = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        Integer status = e.getHttpStatus();

        if ((status != null && status == 409)
                || detail.contains("already exists")
                || detail.contains("already taken")) {
            return ProvisioningErrorCode.IDENTITY_TAKEN;
        }
        if (detail.contains("host not found")
                || detail.contains("unknown host")
                || (status != null && status == 404 && detail.contains("host"))) {
            return ProvisioningErrorCode.HOST_NOT_FOUND;
        }
        if (detail.contains("timed out") || detail.contains("timeout")) {
            return ProvisioningErrorCode.TIMEOUT;
        }
        return ProvisioningErrorCode.UPSTREAM_ERROR;
    }
}

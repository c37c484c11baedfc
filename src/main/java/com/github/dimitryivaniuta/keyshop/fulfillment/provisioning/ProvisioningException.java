package com.github.dimitryivaniuta.keyshop.fulfillment.provisioning;

import lombok.Getter;

/**
 * A provisioning call failed.
 *
 * <p>Carries the raw upstream detail for operators; payers only ever see the classified code.</p>
 */
@Getter
public class ProvisioningException extends Exception {

    /**
     * HTTP status returned by the panel, {@code null} when no response was received.
     */
    private final Integer httpStatus;

    /**
     * True when the call ran into the connect or read timeout.
     */
    private final boolean timeout;

    /**
     * Code decided by the caller before any remote call was made, {@code null} when it must be classified.
     */
    private final ProvisioningErrorCode code;

    public ProvisioningException(String message, Integer httpStatus, boolean timeout, Throwable cause) {
        this(message, httpStatus, timeout, null, cause);
    }

    private ProvisioningException(String message, Integer httpStatus, boolean timeout, ProvisioningErrorCode code,
                                  Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.timeout = timeout;
        this.code = code;
    }

    public static ProvisioningException invalidOrder(String message) {
        return new ProvisioningException(message, null, false, ProvisioningErrorCode.INVALID_ORDER, null);
    }

    public static ProvisioningException identityTaken(String identity) {
        return new ProvisioningException("Identity already taken: " + identity, 409, false,
                ProvisioningErrorCode.IDENTITY_TAKEN, null);
    }

    public static ProvisioningException timedOut(String message, Throwable cause) {
        return new ProvisioningException(message, null, true, cause);
    }

    public static ProvisioningException rejected(int httpStatus, String message) {
        return new ProvisioningException(message, httpStatus, false, null);
    }
}

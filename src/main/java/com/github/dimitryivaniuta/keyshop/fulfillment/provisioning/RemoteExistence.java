package com.github.dimitryivaniuta.keyshop.fulfillment.provisioning;

/**
 * Answer of a remote existence check.
 */
public enum RemoteExistence {
    /** The panel has the credential. */
    PRESENT,
    /** The panel positively reported that the credential does not exist. */
    ABSENT,
    /** The check failed (timeout, 5xx, unreachable host); nothing may be concluded. */
    UNKNOWN
}

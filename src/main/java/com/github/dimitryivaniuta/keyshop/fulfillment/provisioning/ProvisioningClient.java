package com.github.dimitryivaniuta.keyshop.fulfillment.provisioning;

/**
 * Remote panel that issues, extends and deletes access keys.
 */
public interface ProvisioningClient {

    /**
     * Creates the credential, or extends it when {@link ProvisioningRequest#remoteUuid()} is set.
     *
     * @param request request
     * @return credential as stored by the panel
     * @throws ProvisioningException on timeout or rejection
     */
    ProvisionedCredential createOrExtend(ProvisioningRequest request) throws ProvisioningException;

    /**
     * Checks whether the panel still has a credential. Never throws: failures are {@link RemoteExistence#UNKNOWN}.
     *
     * @param host       panel host
     * @param identity   credential handle
     * @param remoteUuid remote uuid, may be {@code null}
     * @return existence
     */
    RemoteExistence exists(String host, String identity, String remoteUuid);

    /**
     * Deletes a credential on the panel.
     *
     * @param host     panel host
     * @param identity credential handle
     * @return true when deleted or already gone
     */
    boolean delete(String host, String identity);
}

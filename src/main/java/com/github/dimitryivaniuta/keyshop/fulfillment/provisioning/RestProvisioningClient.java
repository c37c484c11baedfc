package com.github.dimitryivaniuta.keyshop.fulfillment.provisioning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link ProvisioningClient} talking JSON to the panel gateway.
 *
 * <p>Endpoints (relative to {@code app.provisioning.base-url}):
 * <ul>
 *   <li>{@code PUT /api/hosts/{host}/users/{identity}}: create or extend</li>
 *   <li>{@code GET /api/hosts/{host}/users/{identity}}: 200 present, 404 absent</li>
 *   <li>{@code DELETE /api/hosts/{host}/users/{identity}}</li>
 * </ul>
 */
@Slf4j
@Component
public class RestProvisioningClient implements ProvisioningClient {

    private static final String USER_PATH = "/api/hosts/{host}/users/{identity}";

    private final RestTemplate restTemplate;

    public RestProvisioningClient(@Qualifier("provisioningRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ProvisionedCredential createOrExtend(ProvisioningRequest request) throws ProvisioningException {
        PanelUserRequest body = new PanelUserRequest(request.remoteUuid(), request.expiresAt(),
                request.trafficLimitBytes(), request.deviceLimit());
        try {
            PanelUser user = restTemplate.exchange(
                    USER_PATH,
                    HttpMethod.PUT,
                    new HttpEntity<>(body),
                    PanelUser.class,
                    request.host(), request.identity()
            ).getBody();
            if (user == null) {
                throw ProvisioningException.rejected(HttpStatus.BAD_GATEWAY.value(), "Empty response from panel");
            }
            return new ProvisionedCredential(request.host(),
                    user.identity() != null ? user.identity() : request.identity(),
                    user.uuid(), user.expiresAt(), user.connectionInfo());
        } catch (HttpStatusCodeException e) {
            throw ProvisioningException.rejected(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw ProvisioningException.timedOut("Panel timed out: " + e.getMessage(), e);
            }
            throw new ProvisioningException("Panel unreachable: " + e.getMessage(), null, false, e);
        } catch (RestClientException e) {
            throw new ProvisioningException(e.getMessage(), null, false, e);
        }
    }

    @Override
    public RemoteExistence exists(String host, String identity, String remoteUuid) {
        try {
            restTemplate.getForEntity(USER_PATH, PanelUser.class, host, identity);
            return RemoteExistence.PRESENT;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return RemoteExistence.ABSENT;
            }
            log.warn("Existence check failed host={} identity={} status={}", host, identity, e.getStatusCode().value());
            return RemoteExistence.UNKNOWN;
        } catch (RestClientException e) {
            log.warn("Existence check failed host={} identity={} error={}", host, identity, e.getMessage());
            return RemoteExistence.UNKNOWN;
        }
    }

    @Override
    public boolean delete(String host, String identity) {
        try {
            restTemplate.delete(USER_PATH, host, identity);
            return true;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return true;
            }
            log.warn("Remote delete failed host={} identity={} status={}", host, identity, e.getStatusCode().value());
            return false;
        } catch (RestClientException e) {
            log.warn("Remote delete failed host={} identity={} error={}", host, identity, e.getMessage());
            return false;
        }
    }

    record PanelUserRequest(String uuid, Instant expiresAt, Long trafficLimitBytes, Integer deviceLimit) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PanelUser(String uuid, String identity, Instant expiresAt, String connectionInfo) {
    }
}

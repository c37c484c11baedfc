package com.github.dimitryivaniuta.keyshop.fulfillment.config;

import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the provisioning panel plus the shared clock.
 *
 * <p>Every provisioning call is bounded by the connect/read timeouts; a timeout is a failed call, never a
 * silent retry.</p>
 */
@Slf4j
@Configuration
public class ProvisioningClientConfig {

    /**
     * RestTemplate dedicated to the provisioning panel.
     *
     * @param builder    Spring's RestTemplate builder
     * @param properties application properties
     * @return rest template
     */
    @Bean("provisioningRestTemplate")
    public RestTemplate provisioningRestTemplate(RestTemplateBuilder builder, AppProperties properties) {
        AppProperties.Provisioning cfg = properties.getProvisioning();
        RestTemplate restTemplate = builder
                .rootUri(cfg.getBaseUrl())
                .setConnectTimeout(cfg.getConnectTimeout())
                .setReadTimeout(cfg.getReadTimeout())
                .additionalInterceptors(loggingInterceptor(), authInterceptor(cfg.getApiToken()))
                .build();

        log.info("Provisioning client configured baseUrl={} connectTimeout={} readTimeout={}",
                cfg.getBaseUrl(), cfg.getConnectTimeout(), cfg.getReadTimeout());
        return restTemplate;
    }

    /**
     * Clock used for ledger timestamps and the reconciliation grace window.
     *
     * @return system UTC clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long t0 = System.nanoTime();
            var response = execution.execute(request, body);
            log.debug("Provisioning {} {} -> {} in {}ms", request.getMethod(), request.getURI(),
                    response.getStatusCode().value(), (System.nanoTime() - t0) / 1_000_000);
            return response;
        };
    }

    private ClientHttpRequestInterceptor authInterceptor(String token) {
        return (request, body, execution) -> {
            if (token != null && !token.isBlank()) {
                request.getHeaders().setBearerAuth(token);
            }
            return execution.execute(request, body);
        };
    }
}

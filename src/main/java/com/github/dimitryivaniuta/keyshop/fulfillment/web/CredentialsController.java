package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningErrorCode;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningException;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.CredentialService;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.ProvisioningErrorClassifier;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.CredentialResponse;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.ErrorResponse;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.HostRequest;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Credential lifecycle outside of payments: trial, host switch, operator delete.
 */
@Slf4j
@RestController
public class CredentialsController {

    private final CredentialService credentialService;
    private final ProvisioningErrorClassifier classifier;

    public CredentialsController(CredentialService credentialService, ProvisioningErrorClassifier classifier) {
        this.credentialService = credentialService;
        this.classifier = classifier;
    }

    @GetMapping(value = "/api/owners/{ownerId}/credentials", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CredentialResponse> list(@PathVariable long ownerId) {
        return credentialService.listFor(ownerId).stream().map(CredentialResponse::from).toList();
    }

    @PostMapping(value = "/api/owners/{ownerId}/trial", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CredentialResponse> trial(@PathVariable long ownerId, @Valid @RequestBody HostRequest request)
            throws ProvisioningException {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CredentialResponse.from(credentialService.issueTrial(ownerId, request.host())));
    }

    @PostMapping(value = "/api/owners/{ownerId}/credentials/{credentialId}/host",
            consumes = MediaType.APPLICATION_JSON_VALUE)
    public CredentialResponse switchHost(@PathVariable long ownerId, @PathVariable long credentialId,
                                         @Valid @RequestBody HostRequest request) throws ProvisioningException {
        return CredentialResponse.from(credentialService.switchHost(ownerId, credentialId, request.host()));
    }

    @DeleteMapping("/api/admin/credentials/{credentialId}")
    public ResponseEntity<Void> delete(@PathVariable long credentialId) {
        return credentialService.deleteByOperator(credentialId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * The raw panel detail stays in the logs; the payer sees the classified code.
     */
    @ExceptionHandler(ProvisioningException.class)
    public ResponseEntity<ErrorResponse> handleProvisioning(ProvisioningException ex) {
        ProvisioningErrorCode code = classifier.classify(ex);
        log.warn("Provisioning failed code={} status={} detail={}", code, ex.getHttpStatus(), ex.getMessage());
        HttpStatus status = switch (code) {
            case IDENTITY_TAKEN -> HttpStatus.CONFLICT;
            case HOST_NOT_FOUND, INVALID_ORDER -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_ERROR -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(new ErrorResponse(code.name(), "Provisioning failed", Instant.now()));
    }
}

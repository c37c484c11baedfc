package com.github.dimitryivaniuta.keyshop.fulfillment.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Verifier for providers that sign the raw body with HMAC-SHA256 and a shared secret.
 *
 * <p>Expected body:
 * <pre>{@code
 * {"id":"prov-1","status":"succeeded","amount":"199.00","currency":"RUB","metadata":{"payment_id":"ord-1"}}
 * }</pre>
 */
public class HmacPaymentVerifier implements PaymentVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final String provider;
    private final byte[] secret;
    private final String signatureHeader;
    private final ObjectMapper objectMapper;

    public HmacPaymentVerifier(String provider, String secret, String signatureHeader, ObjectMapper objectMapper) {
        this.provider = provider.toLowerCase(Locale.ROOT);
        this.secret = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        this.signatureHeader = signatureHeader;
        this.objectMapper = objectMapper;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public VerifiedPayment verify(RawWebhook webhook) {
        if (secret.length == 0) {
            throw new PaymentVerificationException("No secret configured for provider " + provider);
        }
        String signature = webhook.header(signatureHeader);
        if (signature == null || signature.isBlank()) {
            throw new PaymentVerificationException("Missing signature header " + signatureHeader);
        }
        byte[] expected = sign(webhook.body() == null ? "" : webhook.body());
        byte[] actual;
        try {
            actual = HexFormat.of().parseHex(signature.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PaymentVerificationException("Malformed signature", e);
        }
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new PaymentVerificationException("Signature mismatch for provider " + provider);
        }
        return parse(webhook.body());
    }

    /**
     * Hex signature of a body, as a provider would send it.
     *
     * @param body raw body
     * @return lower-case hex HMAC
     */
    public String signHex(String body) {
        return HexFormat.of().formatHex(sign(body));
    }

    private byte[] sign(String body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private VerifiedPayment parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PaymentVerificationException("Malformed body", e);
        }
        String providerPaymentId = text(root, "id");
        String internalPaymentId = text(root.path("metadata"), "payment_id");
        if (internalPaymentId == null || internalPaymentId.isBlank()) {
            throw new PaymentVerificationException("Notification carries no internal payment id");
        }
        BigDecimal amount;
        try {
            String raw = text(root, "amount");
            amount = raw == null ? null : new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new PaymentVerificationException("Malformed amount", e);
        }
        String status = text(root, "status");
        boolean succeeded = status != null
                && (status.equalsIgnoreCase("succeeded") || status.equalsIgnoreCase("paid"));
        return new VerifiedPayment(providerPaymentId, amount, text(root, "currency"), internalPaymentId, succeeded);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}

package com.wafsentinel.engine.hardening;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures over the canonical JSON form of a diff (sorted keys,
 * ISO timestamps, signature field cleared).
 *
 * @author WAF Sentinel Team
 */
public class DiffSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;
    private final ObjectMapper canonical = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public DiffSigner(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Diff signing key must not be blank");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public RuleSetDiff sign(RuleSetDiff diff) {
        return diff.withSignature(signature(diff));
    }

    public boolean verify(RuleSetDiff diff) {
        if (diff.signature() == null) {
            return false;
        }
        return MessageDigest.isEqual(
                signature(diff).getBytes(StandardCharsets.US_ASCII),
                diff.signature().getBytes(StandardCharsets.US_ASCII));
    }

    private String signature(RuleSetDiff diff) {
        try {
            byte[] payload = canonical.writeValueAsBytes(diff.withSignature(null));
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize diff " + diff.cycleId(), e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }
}

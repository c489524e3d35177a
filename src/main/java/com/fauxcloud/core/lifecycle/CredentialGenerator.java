package com.fauxcloud.core.lifecycle;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Random identifiers and secrets for new instances.
 */
@Component
public class CredentialGenerator {

    public static final String ID_PREFIX = "fsc-";

    private final SecureRandom random = new SecureRandom();

    /**
     * {@code fsc-} followed by 16 lowercase hex characters.
     */
    public String instanceId() {
        return ID_PREFIX + HexFormat.of().formatHex(bytes(8));
    }

    /**
     * URL-safe administrator password from 16 random bytes.
     */
    public String adminPassword() {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes(16));
    }

    /**
     * 64 hex characters.
     */
    public String ingestionToken() {
        return HexFormat.of().formatHex(bytes(32));
    }

    private byte[] bytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }
}

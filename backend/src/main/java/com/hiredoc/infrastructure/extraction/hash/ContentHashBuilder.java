package com.hiredoc.infrastructure.extraction.hash;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds the SHA-256 content hash callers use to spot duplicate submissions
 * without re-running extraction.
 */
@Component
public class ContentHashBuilder {

    /**
     * @param text document text as submitted (null hashes like the empty string)
     * @return hex-encoded SHA-256 of the UTF-8 bytes
     */
    public String hash(String text) {
        return sha256(text != null ? text : "");
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

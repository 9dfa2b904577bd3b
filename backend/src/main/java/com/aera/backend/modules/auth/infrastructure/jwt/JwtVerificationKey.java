package com.aera.backend.modules.auth.infrastructure.jwt;

import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HS256 key shared with the auth service, used here only to check signatures.
 * {@code jwt.secret} must be Base64 and decode to at least 32 bytes; anything else stops startup.
 */
@Component
public class JwtVerificationKey {

    private final SecretKey key;

    public JwtVerificationKey(@Value("${jwt.secret}") String encodedSecret) {
        if (encodedSecret == null || encodedSecret.isBlank()) {
            throw new IllegalStateException("jwt.secret is not configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encodedSecret.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("jwt.secret must be Base64 encoded", ex);
        }
        try {
            this.key = Keys.hmacShaKeyFor(keyBytes);
        } catch (WeakKeyException ex) {
            throw new IllegalStateException("jwt.secret must decode to at least 32 bytes, got " + keyBytes.length, ex);
        }
    }

    public SecretKey key() {
        return key;
    }
}

package com.fauxcloud.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.List;

@Service
public class JwtAccessTokenIssuer implements AccessTokenIssuer {

    static final String ISSUER = "faux-cloud";
    static final List<String> ROLES = List.of("sc_admin");
    static final List<String> CAPABILITIES = List.of(
            "admin_all_objects", "edit_indexes", "edit_tokens_settings", "list_inputs", "search");

    private final SecretKey signingKey;
    private final long expirationSeconds;
    private final Clock clock;

    public JwtAccessTokenIssuer(
            @Value("${fauxcloud.security.jwt.secret}") String secret,
            @Value("${fauxcloud.security.jwt.expiration-seconds:86400}") long expirationSeconds,
            Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = expirationSeconds;
        this.clock = clock;
    }

    @Override
    public String issue(String instanceId) {
        Date now = Date.from(clock.instant());
        Date expiration = new Date(now.getTime() + expirationSeconds * 1000L);

        return Jwts.builder()
                .subject("admin")
                .issuer(ISSUER)
                .audience().add("acs:" + instanceId).and()
                .claim("stack", instanceId)
                .claim("roles", ROLES)
                .claim("capabilities", CAPABILITIES)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(signingKey)
                .compact();
    }

    /**
     * Verifies a token issued by this service; used by the admin-config emulation and tests.
     */
    public Claims validate(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}

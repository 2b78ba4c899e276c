package com.therian.chatbackend.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Issues and verifies the signed session token. The token carries only the
 * identity id as its subject; the key is read once from configuration.
 */
@Service
public class JwtService {

    private final SecretKey key;
    private final long sessionTokenExpirationMs;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.session-token.expiration-ms:2592000000}") long sessionTokenExpirationMs
    ) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.sessionTokenExpirationMs = sessionTokenExpirationMs;
    }

    public String issue(String identityId) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setSubject(identityId)
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + sessionTokenExpirationMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return the identity id the token was issued for
     * @throws AuthException {@link AuthError#EXPIRED} past validity, {@link AuthError#INVALID} otherwise
     */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthError.INVALID, "Missing token");
        }
        Claims claims;
        try {
            claims = parse(token);
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthError.EXPIRED, "Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthError.INVALID, "Invalid token", e);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthException(AuthError.INVALID, "Invalid token");
        }
        return subject;
    }

    private Claims parse(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(key)
                .setAllowedClockSkewSeconds(5)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}

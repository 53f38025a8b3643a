package com.sneaklink.auth.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * JWT Token 服務
 *
 * 只負責驗證與解析；token 由外部登入服務以同一把 HMAC-SHA256 secret 簽發。
 * subject = accountId，claim "role" = USER / ADMIN（缺少時視為 USER）。
 */
@Slf4j
@Service
public class JwtService {

    private final SecretKey signingKey;

    public JwtService(@Value("${jwt.secret}") String secret) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 驗證 Token 是否有效
     *
     * @return true = 簽章正確且未過期
     */
    public boolean validateToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        try {
            parseClaims(token);
            return true;
        } catch (ExpiredJwtException e) {
            log.warn("JWT 已過期: {}", e.getMessage());
        } catch (JwtException e) {
            log.warn("JWT 驗證失敗: {}", e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("JWT 格式錯誤: {}", e.getMessage());
        }
        return false;
    }

    public String extractAccountId(String token) {
        return parseClaims(token).getSubject();
    }

    public String extractRole(String token) {
        String role = parseClaims(token).get("role", String.class);
        return role != null ? role : "USER";
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}

package com.demo.sessionauth.token;

import com.demo.sessionauth.exception.InvalidTokenFormatException;
import com.demo.sessionauth.exception.SigningMisconfiguredException;
import com.demo.sessionauth.properties.SessionAuthProperties.TokenSettings;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * JWT 编解码
 * <p>
 * 功能：按一组 {@link TokenSettings} 签名与解析 compact JWT，不涉及任何存储。
 * access 与 refresh 各自持有一个实例（密钥、算法、有效期可以不同）。
 * <p>
 * 约定：
 * - sub = userId
 * - type = "access" | "refresh"
 * - iss / aud 仅在配置时写入，并在每次解析时强制校验
 * - 头部 alg 必须与配置算法一致
 */
public class JwtCodec {

    private static final Logger log = LoggerFactory.getLogger(JwtCodec.class);

    public static final String CLAIM_TYPE = "type";
    public static final String CLAIM_USER_ID = "userId";
    public static final String CLAIM_SESSION_ID = "sessionId";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_PERMISSIONS = "permissions";
    public static final String CLAIM_USER_DATA = "userData";
    public static final String CLAIM_NONCE = "nonce";
    public static final String CLAIM_AUD = "aud";

    private static final ObjectMapper PAYLOAD_READER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final TokenSettings settings;
    private final SecretKey key;
    private final long clockSkewSeconds;
    private final Clock clock;

    /**
     * @param name 仅用于错误信息（"access" / "refresh"）
     * @throws SigningMisconfiguredException 密钥缺失、长度不足或有效期非法
     */
    public JwtCodec(String name, TokenSettings settings, Duration clockSkew, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.clockSkewSeconds = clockSkew == null ? 0 : clockSkew.getSeconds();
        validateSettings();
        this.key = initKey();
    }

    public Duration ttl() {
        return settings.getTtl();
    }

    // =========================
    // 签发
    // =========================

    /**
     * 签名（iat=now，exp=now+ttl，sub=subject）。
     */
    public String sign(String subject, String tokenId, Map<String, Object> claims) {
        Instant now = clock.instant();

        var builder = Jwts.builder()
                .subject(subject)
                .claims(claims)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(settings.getTtl())));

        if (StringUtils.hasText(tokenId)) {
            builder.id(tokenId);
        }
        if (StringUtils.hasText(settings.getIssuer())) {
            builder.issuer(settings.getIssuer());
        }
        // aud 以单值写入，解析时兼容 String / Collection 两种形态
        if (StringUtils.hasText(settings.getAudience())) {
            builder.audience().single(settings.getAudience());
        }

        return builder.signWith(key, settings.getAlgorithm().jwa()).compact();
    }

    // =========================
    // 解析 + 基础校验
    // =========================

    /**
     * 校验签名、exp、alg、iss、aud。
     *
     * @param allowExpired 为 true 时，过期 token 在其余校验通过的前提下照常返回声明
     * @throws ExpiredJwtException token 已过期且 allowExpired=false
     * @throws JwtException        其他校验失败
     */
    public Claims parse(String token, boolean allowExpired) {
        if (!StringUtils.hasText(token)) {
            throw new IllegalArgumentException("Token is blank");
        }

        Header header;
        Claims claims;
        try {
            Jws<Claims> jws = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .clockSkewSeconds(clockSkewSeconds)
                    .build()
                    .parseSignedClaims(token);
            header = jws.getHeader();
            claims = jws.getPayload();
        } catch (ExpiredJwtException e) {
            // JJWT 在校验 exp 之前已经完成签名校验
            if (!allowExpired) {
                throw e;
            }
            header = e.getHeader();
            claims = e.getClaims();
        }

        validateAlgorithm(header);
        validateIssuer(claims);
        validateAudience(claims);
        return claims;
    }

    /**
     * 不校验签名地解码 payload。仅用于已经校验过的 token 或管理类操作（读取 exp 等）。
     *
     * @throws InvalidTokenFormatException 不是合法的 compact JWT
     */
    public static Map<String, Object> decodeUnverified(String token) {
        if (!StringUtils.hasText(token)) {
            throw new InvalidTokenFormatException("Token is blank");
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            throw new InvalidTokenFormatException("Token is not a compact JWT");
        }
        try {
            byte[] json = Decoders.BASE64URL.decode(parts[1]);
            return PAYLOAD_READER.readValue(json, PAYLOAD_TYPE);
        } catch (IOException | RuntimeException e) {
            throw new InvalidTokenFormatException("Token payload cannot be decoded");
        }
    }

    // =========================
    // 声明读取
    // =========================

    public static String stringClaim(Map<String, Object> claims, String name) {
        Object v = claims.get(name);
        if (v == null) return null;
        String s = String.valueOf(v);
        return StringUtils.hasText(s) ? s : null;
    }

    public static Set<String> stringSetClaim(Map<String, Object> claims, String name) {
        Object v = claims.get(name);
        if (!(v instanceof Collection<?> c) || c.isEmpty()) {
            return Set.of();
        }
        Set<String> res = new LinkedHashSet<>();
        for (Object x : c) {
            if (x == null) continue;
            String s = String.valueOf(x).trim();
            if (!s.isEmpty()) res.add(s);
        }
        return Collections.unmodifiableSet(res);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> mapClaim(Map<String, Object> claims, String name) {
        Object v = claims.get(name);
        if (v instanceof Map<?, ?> m) {
            return Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) m));
        }
        return Map.of();
    }

    public static Instant instantClaim(Map<String, Object> claims, String name) {
        Object v = claims.get(name);
        if (v instanceof Date d) return d.toInstant();
        if (v instanceof Number n) return Instant.ofEpochSecond(n.longValue());
        return null;
    }

    // =========================
    // 内部辅助方法
    // =========================

    private void validateAlgorithm(Header header) {
        String expected = settings.getAlgorithm().jwa().getId();
        String actual = header == null ? null : header.getAlgorithm();
        if (!expected.equals(actual)) {
            throw new UnsupportedJwtException("Unexpected signing algorithm: " + actual);
        }
    }

    private void validateIssuer(Claims claims) {
        String expected = settings.getIssuer();
        if (!StringUtils.hasText(expected)) {
            return;
        }
        if (!expected.equals(claims.getIssuer())) {
            throw new UnsupportedJwtException("Invalid issuer");
        }
    }

    private void validateAudience(Claims claims) {
        String expected = settings.getAudience();
        if (!StringUtils.hasText(expected)) {
            return;
        }
        if (!extractAudience(claims).contains(expected)) {
            throw new UnsupportedJwtException("Invalid audience");
        }
    }

    private List<String> extractAudience(Claims claims) {
        // 先取标准 API，再退回原始 claim
        List<String> fromStandard = normalizeAudience(claims.getAudience());
        if (!fromStandard.isEmpty()) return fromStandard;
        return normalizeAudience(claims.get(CLAIM_AUD));
    }

    private static List<String> normalizeAudience(Object audObj) {
        if (audObj == null) return List.of();
        if (audObj instanceof String s) {
            return StringUtils.hasText(s) ? List.of(s) : List.of();
        }
        if (audObj instanceof Collection<?> c) {
            List<String> list = new ArrayList<>();
            for (Object x : c) {
                if (x != null && StringUtils.hasText(String.valueOf(x))) list.add(String.valueOf(x));
            }
            return list;
        }
        String v = String.valueOf(audObj);
        return StringUtils.hasText(v) ? List.of(v) : List.of();
    }

    private void validateSettings() {
        if (settings.getAlgorithm() == null) {
            throw misconfigured("session-auth.jwt." + name + ".algorithm must be set");
        }
        Duration ttl = settings.getTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw misconfigured("session-auth.jwt." + name + ".ttl must be > 0");
        }
        if (!StringUtils.hasText(settings.getSecret())) {
            throw misconfigured("session-auth.jwt." + name + ".secret must not be blank");
        }
    }

    private SecretKey initKey() {
        byte[] bytes = settings.getSecret().getBytes(StandardCharsets.UTF_8);
        SigningAlgorithm algorithm = settings.getAlgorithm();
        if (bytes.length < algorithm.minKeyBytes()) {
            throw misconfigured("session-auth.jwt." + name + ".secret length must be at least "
                    + algorithm.minKeyBytes() + " bytes for " + algorithm);
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    private static SigningMisconfiguredException misconfigured(String message) {
        log.error("JWT signing misconfigured: {}", message);
        return new SigningMisconfiguredException(message);
    }
}

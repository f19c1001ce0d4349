package com.saddlery.auth.token;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.nimbusds.jose.proc.SecurityContext;
import com.saddlery.auth.config.AuthProperties;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * 令牌签名器。
 * <p>
 * 以 HS256 签发与校验紧凑 JWT，每种 {@link TokenPurpose} 使用独立的密钥与有效期：
 * - ACCESS 使用 `auth.tokens.access`；
 * - REFRESH 使用 `auth.tokens.refresh`；
 * - CONFIRM_EMAIL 与 CONFIRM_NEW_EMAIL 共用 `auth.tokens.confirm-email`，以 `token_type` 区分；
 * - FORGOT_PASSWORD 使用 `auth.tokens.forgot-password`。
 * 构造后不可变，可被任意线程并发调用。校验失败统一抛出 {@link InvalidTokenException}。
 */
public class TokenSigner {

    public static final String CLAIM_TOKEN_TYPE = "token_type";
    private static final int MIN_SECRET_BYTES = 32;

    private final Map<TokenPurpose, Codec> codecs = new EnumMap<>(TokenPurpose.class);
    private final String issuer;
    private final Clock clock;

    public TokenSigner(AuthProperties.Tokens tokens, Clock clock) {
        this.issuer = tokens.getIssuer();
        this.clock = clock;
        register(TokenPurpose.ACCESS, tokens.getAccess(), "access");
        register(TokenPurpose.REFRESH, tokens.getRefresh(), "refresh");
        register(TokenPurpose.CONFIRM_EMAIL, tokens.getConfirmEmail(), "confirm-email");
        register(TokenPurpose.CONFIRM_NEW_EMAIL, tokens.getConfirmEmail(), "confirm-email");
        register(TokenPurpose.FORGOT_PASSWORD, tokens.getForgotPassword(), "forgot-password");
    }

    /**
     * 按用途签发令牌。
     * <p>
     * 在给定声明之外写入 `iss`、`iat`、`exp` 与 `token_type`。
     *
     * @param purpose 令牌用途。
     * @param claims  自定义声明。
     * @return 令牌字符串与签发/过期时间。
     */
    public SignedToken sign(TokenPurpose purpose, Map<String, Object> claims) {
        Codec codec = codecs.get(purpose);
        Instant issuedAt = Instant.now(clock);
        Instant expiresAt = issuedAt.plus(codec.ttl());
        JwtClaimsSet.Builder builder = JwtClaimsSet.builder()
                .issuer(issuer)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .claim(CLAIM_TOKEN_TYPE, purpose.tokenType());
        claims.forEach(builder::claim);
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String value = codec.encoder().encode(JwtEncoderParameters.from(header, builder.build())).getTokenValue();
        return new SignedToken(value, issuedAt, expiresAt);
    }

    /**
     * 按用途校验令牌：签名、过期时间、签发者与 `token_type`。
     *
     * @param purpose 期望的令牌用途。
     * @param token   令牌字符串。
     * @return 解析后的 JWT。
     * @throws InvalidTokenException 任一校验失败时抛出，不区分过期与伪造。
     */
    public Jwt verify(TokenPurpose purpose, String token) {
        if (!StringUtils.hasText(token)) {
            throw new InvalidTokenException("Token is empty");
        }
        try {
            return codecs.get(purpose).decoder().decode(token);
        } catch (JwtException ex) {
            throw new InvalidTokenException("Token rejected for purpose " + purpose, ex);
        }
    }

    /**
     * 给定用途的解码器，供资源服务器校验访问令牌。
     *
     * @param purpose 令牌用途。
     * @return 该用途的 {@link JwtDecoder}。
     */
    public JwtDecoder decoder(TokenPurpose purpose) {
        return codecs.get(purpose).decoder();
    }

    /**
     * 读取整数型声明，兼容数字与字符串两种编码。
     *
     * @param jwt   已校验的 JWT。
     * @param claim 声明名。
     * @return 声明值。
     * @throws InvalidTokenException 声明缺失或类型不合法时抛出。
     */
    public static long requireLong(Jwt jwt, String claim) {
        Object value = jwt.getClaims().get(claim);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException ex) {
                throw new InvalidTokenException("Claim " + claim + " is not numeric", ex);
            }
        }
        throw new InvalidTokenException("Claim " + claim + " is missing");
    }

    /**
     * 读取非空字符串声明。
     *
     * @param jwt   已校验的 JWT。
     * @param claim 声明名。
     * @return 声明值。
     * @throws InvalidTokenException 声明缺失或为空时抛出。
     */
    public static String requireText(Jwt jwt, String claim) {
        Object value = jwt.getClaims().get(claim);
        if (value instanceof String text && StringUtils.hasText(text)) {
            return text;
        }
        throw new InvalidTokenException("Claim " + claim + " is missing");
    }

    private void register(TokenPurpose purpose, AuthProperties.TokenSettings settings, String propertyName) {
        if (settings == null || !StringUtils.hasText(settings.getSecret())) {
            throw new IllegalStateException("auth.tokens." + propertyName + ".secret must be configured");
        }
        byte[] secret = settings.getSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("auth.tokens." + propertyName + ".secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        Duration ttl = settings.getTtl();
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalStateException("auth.tokens." + propertyName + ".ttl must be positive");
        }
        SecretKey key = new SecretKeySpec(secret, "HmacSHA256");
        JwtEncoder encoder = new NimbusJwtEncoder(new ImmutableSecret<SecurityContext>(key));
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        JwtTimestampValidator timestamps = new JwtTimestampValidator(Duration.ZERO);
        timestamps.setClock(clock);
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
                timestamps,
                new JwtIssuerValidator(issuer),
                new JwtClaimValidator<Object>(CLAIM_TOKEN_TYPE, purpose.tokenType()::equals)));
        codecs.put(purpose, new Codec(encoder, decoder, ttl));
    }

    private record Codec(JwtEncoder encoder, JwtDecoder decoder, Duration ttl) {
    }
}

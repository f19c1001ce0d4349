package com.saddlery.auth.api;

import com.saddlery.auth.api.dto.*;
import com.saddlery.auth.model.ClientInfo;
import com.saddlery.auth.service.AuthService;
import com.saddlery.auth.token.TokenIssuer;
import com.saddlery.auth.token.TokenSigner;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 认证 API 控制器。
 * <p>
 * 暴露 REST 接口：邮箱登录、注册、确认邮箱、找回/重置密码、刷新令牌、登出、查询与更新当前账号。
 * 集成：使用 Spring Security 的资源服务器能力，需登录的接口通过 `@AuthenticationPrincipal Jwt` 提取账号与会话。
 * 客户端信息：从请求头解析 IP 与 UA，用于审计。
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Validated
public class AuthController {

    private final AuthService authService;

    /**
     * 邮箱或用户名密码登录。
     *
     * @param request     请求体，包含：identifier（邮箱或用户名）、password。
     * @param httpRequest 用于解析客户端信息（IP 与 User-Agent），记录审计日志。
     * @return 登录响应，包含令牌对、访问令牌过期时间与账号信息。
     */
    @PostMapping("/email/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return authService.login(request, resolveClient(httpRequest));
    }

    /**
     * 邮箱注册，确认邮件发送后返回 204。
     *
     * @param request 请求体，包含：邮箱、密码、可选用户名与姓名。
     * @return 空响应，HTTP 204 No Content。
     */
    @PostMapping("/email/register")
    public ResponseEntity<Void> register(@Valid @RequestBody RegisterRequest request) {
        authService.register(request);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/email/confirm")
    public ResponseEntity<Void> confirmEmail(@Valid @RequestBody HashRequest request) {
        authService.confirmEmail(request.hash());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/email/confirm/new")
    public ResponseEntity<Void> confirmNewEmail(@Valid @RequestBody HashRequest request) {
        authService.confirmNewEmail(request.hash());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/forgot/password")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.forgotPassword(request.email());
        return ResponseEntity.noContent().build();
    }

    /**
     * 使用找回密码令牌重置密码。
     * <p>
     * 成功后账号的全部会话失效，所有设备需重新登录。
     *
     * @param request 请求体，包含：hash（重置令牌）、password（新密码）。
     * @return 空响应，HTTP 204 No Content。
     */
    @PostMapping("/reset/password")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody PasswordResetRequest request) {
        authService.resetPassword(request);
        return ResponseEntity.noContent().build();
    }

    /**
     * 使用 Refresh Token 刷新令牌。
     * <p>
     * 会话 hash 轮换后旧刷新令牌立即失效；任何失败均返回 401。
     *
     * @param request 请求体，包含：refreshToken（刷新令牌）。
     * @return 新的令牌响应。
     */
    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody TokenRefreshRequest request) {
        return authService.refresh(request);
    }

    /**
     * 登出：删除访问令牌所属会话。
     *
     * @param jwt         当前请求绑定的访问令牌。
     * @param httpRequest 用于解析客户端信息。
     * @return 空响应，HTTP 204 No Content。
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal Jwt jwt, HttpServletRequest httpRequest) {
        authService.logout(userId(jwt), sessionId(jwt), resolveClient(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    public AuthUserResponse me(@AuthenticationPrincipal Jwt jwt) {
        return authService.me(userId(jwt));
    }

    @PatchMapping("/me")
    public AuthUserResponse update(@AuthenticationPrincipal Jwt jwt, @RequestBody AuthUpdateRequest request) {
        return authService.update(userId(jwt), sessionId(jwt), request);
    }

    private long userId(Jwt jwt) {
        return TokenSigner.requireLong(jwt, TokenIssuer.CLAIM_ID);
    }

    private long sessionId(Jwt jwt) {
        return TokenSigner.requireLong(jwt, TokenIssuer.CLAIM_SESSION_ID);
    }

    /**
     * 从请求中解析客户端信息。
     *
     * @param request HTTP 请求对象。
     * @return 客户端信息（IP 与 User-Agent）。
     */
    private ClientInfo resolveClient(HttpServletRequest request) {
        String ip = extractClientIp(request);
        String ua = request.getHeader("User-Agent");
        return new ClientInfo(ip, ua);
    }

    /**
     * 提取客户端 IP 地址。
     * <p>
     * 优先使用代理头：`X-Forwarded-For`（取第一个）、`X-Real-IP`；否则回退到 `request.getRemoteAddr()`。
     *
     * @param request HTTP 请求对象。
     * @return 客户端 IP。
     */
    private String extractClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}

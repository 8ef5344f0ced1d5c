package com.anyllm.gateway.auth.controller;

import com.anyllm.gateway.auth.dto.LogoutRequest;
import com.anyllm.gateway.auth.dto.RefreshRequest;
import com.anyllm.gateway.auth.dto.SocialLoginRequest;
import com.anyllm.gateway.auth.dto.SocialLoginResponse;
import com.anyllm.gateway.auth.dto.TokenPairResponse;
import com.anyllm.gateway.auth.security.AuthContext;
import com.anyllm.gateway.auth.security.CredentialKind;
import com.anyllm.gateway.auth.service.SessionTokenService;
import com.anyllm.gateway.auth.service.SocialLoginService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final SocialLoginService socialLoginService;
    private final SessionTokenService sessionTokens;
    private final AuthContext auth;

    @PostMapping("/social-login")
    public ResponseEntity<SocialLoginResponse> socialLogin(@Valid @RequestBody SocialLoginRequest body,
                                                           HttpServletRequest req) {
        // user_agent / ip 沒帶時用 HTTP 請求本身的值
        var result = socialLoginService.login(body, req.getRemoteAddr(), req.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest body) {
        var t = sessionTokens.refresh(body.refreshToken(), body.sessionMetadata());
        return ResponseEntity.ok(new TokenPairResponse(
                t.accessToken(), t.accessExpiresAt(), t.refreshToken(), t.refreshExpiresAt()));
    }

    /**
     * 撤銷 body 的 refresh token，以及目前 access token 對應的 session。
     * 找不到 / 已撤銷都回 204；api key 不受影響。
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestBody(required = false) LogoutRequest body) {
        if (body != null && body.refreshToken() != null) {
            sessionTokens.revokeByRefreshToken(body.refreshToken());
        }
        auth.currentPrincipal()
                .filter(p -> p.kind() == CredentialKind.ACCESS_TOKEN)
                .ifPresent(p -> sessionTokens.revokeByJti(p.sessionJti()));
        return ResponseEntity.noContent().build();
    }
}

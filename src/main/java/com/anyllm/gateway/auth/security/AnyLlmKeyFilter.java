package com.anyllm.gateway.auth.security;

import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.common.web.ApiExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * 讀 X-AnyLLM-Key，解析一次 Principal 後放進 SecurityContext 與 request attribute。
 * 下游只透過 AuthContext 讀 Principal。
 */
@Slf4j
@Component
public class AnyLlmKeyFilter extends OncePerRequestFilter {

    public static final String PRINCIPAL_ATTR = "principal";

    private static final String LOGOUT_PATH = "/v1/auth/logout";

    private final CredentialResolver resolver;
    private final ObjectMapper objectMapper;
    private final String headerName;

    public AnyLlmKeyFilter(CredentialResolver resolver,
                           ObjectMapper objectMapper,
                           @Value("${app.auth.header:X-AnyLLM-Key}") String headerName) {
        this.resolver = resolver;
        this.objectMapper = objectMapper;
        this.headerName = headerName;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        // 登入、換發、健康檢查不需要憑證
        return p.equals("/v1/auth/social-login")
                || p.equals("/v1/auth/refresh")
                || p.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String header = req.getHeader(headerName);
        boolean logout = LOGOUT_PATH.equals(req.getRequestURI());

        // logout 可以只帶 refresh_token
        if (logout && (header == null || header.isBlank())) {
            chain.doFilter(req, res);
            return;
        }

        Principal principal;
        try {
            principal = resolver.resolve(header);
        } catch (AuthException e) {
            if (logout) {
                // logout 冪等：憑證失效時仍讓 body 裡的 refresh_token 有機會被撤銷
                chain.doFilter(req, res);
                return;
            }
            log.debug("{} {} rejected: {}", req.getMethod(), req.getRequestURI(), e.code());
            writeError(req, res, e.code(), e.getMessage());
            return;
        }

        String role = principal.isAdmin() ? "ROLE_MASTER" : "ROLE_USER";
        var authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority(role))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        req.setAttribute(PRINCIPAL_ATTR, principal);

        chain.doFilter(req, res);
    }

    private void writeError(HttpServletRequest req, HttpServletResponse res, AuthErrorCode code, String message)
            throws IOException {
        res.setStatus(code.status().value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(res.getWriter(), ApiExceptionHandler.err(code.name(), message, req));
    }
}

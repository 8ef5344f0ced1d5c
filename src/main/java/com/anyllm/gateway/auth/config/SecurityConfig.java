package com.anyllm.gateway.auth.config;

import com.anyllm.gateway.auth.security.AnyLlmKeyFilter;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.common.web.ApiExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.io.IOException;

@Configuration
public class SecurityConfig {

    private final AnyLlmKeyFilter keyFilter;
    private final ObjectMapper objectMapper;

    public SecurityConfig(AnyLlmKeyFilter keyFilter, ObjectMapper objectMapper) {
        this.keyFilter = keyFilter;
        this.objectMapper = objectMapper;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers("/v1/auth/social-login", "/v1/auth/refresh", "/v1/auth/logout").permitAll()
                        .requestMatchers("/actuator/health/**", "/actuator/health", "/error").permitAll()
                        .anyRequest().authenticated()
                )
                .addFilterBefore(keyFilter, UsernamePasswordAuthenticationFilter.class)
                // ✅ 統一 401/403 回 JSON，格式與 AuthExceptionAdvice 相同
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((req, res, e) ->
                                write(req, res, AuthErrorCode.MALFORMED_CREDENTIAL.status().value(),
                                        AuthErrorCode.MALFORMED_CREDENTIAL.name(),
                                        AuthErrorCode.MALFORMED_CREDENTIAL.defaultMessage()))
                        .accessDeniedHandler((req, res, e) ->
                                write(req, res, HttpServletResponse.SC_FORBIDDEN,
                                        AuthErrorCode.FORBIDDEN.name(), "Access denied"))
                );

        return http.build();
    }

    private void write(HttpServletRequest req, HttpServletResponse res, int status, String code, String message)
            throws IOException {
        res.setStatus(status);
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(res.getWriter(), ApiExceptionHandler.err(code, message, req));
    }
}

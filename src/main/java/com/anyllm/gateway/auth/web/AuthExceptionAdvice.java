package com.anyllm.gateway.auth.web;

import com.anyllm.gateway.common.web.ApiExceptionHandler;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AuthExceptionAdvice {

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<Map<String, Object>> handleAuth(AuthException e, HttpServletRequest req) {
        AuthErrorCode code = e.code();
        if (code.status().is5xxServerError()) {
            log.warn("{} {} -> {}", req.getMethod(), req.getRequestURI(), code, e);
        } else {
            log.debug("{} {} -> {}", req.getMethod(), req.getRequestURI(), code);
        }
        return ResponseEntity.status(code.status())
                .body(ApiExceptionHandler.err(code.name(), e.getMessage(), req));
    }
}

package com.anyllm.gateway.auth.web;

import org.springframework.http.HttpStatus;

public enum AuthErrorCode {

    MALFORMED_CREDENTIAL(HttpStatus.UNAUTHORIZED, "Bearer credential required"),
    INVALID_CREDENTIAL(HttpStatus.UNAUTHORIZED, "Invalid credential"),
    REVOKED_OR_UNKNOWN_SESSION(HttpStatus.UNAUTHORIZED, "Session revoked or unknown"),
    EXPIRED_CREDENTIAL(HttpStatus.UNAUTHORIZED, "Access token expired"),

    PROFILE_VERIFICATION_FAILED(HttpStatus.UNAUTHORIZED, "Profile verification failed"),
    UNSUPPORTED_PROVIDER(HttpStatus.BAD_REQUEST, "Unsupported identity provider"),
    PROVISIONING_CONFLICT(HttpStatus.CONFLICT, "Concurrent first login, retry"),
    PROVISIONING_FAILED(HttpStatus.SERVICE_UNAVAILABLE, "Provisioning failed, retry later"),

    INVALID_REFRESH_TOKEN(HttpStatus.UNAUTHORIZED, "Refresh token invalid"),
    REFRESH_EXPIRED(HttpStatus.UNAUTHORIZED, "Refresh token expired, login again"),
    REFRESH_REUSE_DETECTED(HttpStatus.UNAUTHORIZED, "Refresh token reuse detected, login again"),

    TARGET_USER_REQUIRED(HttpStatus.BAD_REQUEST, "When using master key, 'user' is required"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Credential not allowed on this route"),
    USER_BLOCKED(HttpStatus.FORBIDDEN, "User is blocked"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    API_KEY_NOT_FOUND(HttpStatus.NOT_FOUND, "API key not found"),
    BUDGET_EXCEEDED(HttpStatus.PAYMENT_REQUIRED, "Budget exceeded");

    private final HttpStatus status;
    private final String defaultMessage;

    AuthErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() { return status; }
    public String defaultMessage() { return defaultMessage; }
}

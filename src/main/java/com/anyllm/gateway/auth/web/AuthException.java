package com.anyllm.gateway.auth.web;

public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code) {
        this(code, code.defaultMessage());
    }

    public AuthException(AuthErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AuthException(AuthErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AuthErrorCode code() { return code; }
}

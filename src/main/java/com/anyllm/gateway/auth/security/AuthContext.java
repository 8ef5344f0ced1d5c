package com.anyllm.gateway.auth.security;

import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

@Component
public class AuthContext {

    public Optional<Principal> currentPrincipal() {
        // 1) SecurityContext
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof Principal p) {
            return Optional.of(p);
        }

        // 2) request attribute（filter 也會放一份）
        var attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest req = attrs.getRequest();
            if (req.getAttribute(AnyLlmKeyFilter.PRINCIPAL_ATTR) instanceof Principal p) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    public Principal requirePrincipal() {
        return currentPrincipal()
                .orElseThrow(() -> new AuthException(AuthErrorCode.MALFORMED_CREDENTIAL));
    }
}

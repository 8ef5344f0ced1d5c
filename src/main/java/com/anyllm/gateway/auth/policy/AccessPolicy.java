package com.anyllm.gateway.auth.policy;

import com.anyllm.gateway.auth.security.CredentialKind;
import com.anyllm.gateway.auth.security.Principal;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import org.springframework.stereotype.Component;

@Component
public class AccessPolicy {

    /**
     * 判斷 principal 能否使用此路由，並決定實際作用的 user。
     * 一般使用者帶的 target 一律忽略，只能作用在自己身上。
     */
    public AccessDecision authorize(RouteClass route, Principal principal, String targetUserId) {
        if (principal == null) throw new AuthException(AuthErrorCode.MALFORMED_CREDENTIAL);
        if (!route.allows(principal.kind())) {
            throw new AuthException(AuthErrorCode.FORBIDDEN,
                    principal.kind() + " credential not allowed on " + route);
        }

        if (principal.kind() != CredentialKind.MASTER) {
            return new AccessDecision(principal.userId(), false);
        }

        if (!route.masterNeedsTarget()) {
            return new AccessDecision(null, true);
        }
        if (targetUserId == null || targetUserId.isBlank()) {
            throw new AuthException(AuthErrorCode.TARGET_USER_REQUIRED);
        }
        return new AccessDecision(targetUserId.trim(), true);
    }
}

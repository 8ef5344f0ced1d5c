package com.anyllm.gateway.users.controller;

import com.anyllm.gateway.auth.policy.AccessPolicy;
import com.anyllm.gateway.auth.policy.RouteClass;
import com.anyllm.gateway.auth.security.AuthContext;
import com.anyllm.gateway.auth.security.Principal;
import com.anyllm.gateway.users.dto.MeResponse;
import com.anyllm.gateway.users.service.ProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class UserMeController {

    private final AuthContext auth;
    private final AccessPolicy policy;
    private final ProfileService profiles;

    @GetMapping({"/v1/users/me", "/v1/auth/me"})
    public MeResponse me() {
        Principal p = auth.requirePrincipal();
        var d = policy.authorize(RouteClass.SELF_INFO, p, null);
        var u = profiles.requireUser(d.effectiveUserId());
        return new MeResponse(u.getUserId(), p.apiKeyId(), p.kind(), u.getBudgetId(), u.isBlocked());
    }
}

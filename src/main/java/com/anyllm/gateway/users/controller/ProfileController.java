package com.anyllm.gateway.users.controller;

import com.anyllm.gateway.auth.policy.AccessPolicy;
import com.anyllm.gateway.auth.policy.RouteClass;
import com.anyllm.gateway.auth.security.AuthContext;
import com.anyllm.gateway.users.dto.ApiKeyView;
import com.anyllm.gateway.users.dto.ProfileResponse;
import com.anyllm.gateway.users.service.ProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final AuthContext auth;
    private final AccessPolicy policy;
    private final ProfileService profiles;

    /** master 必須帶 user；一般使用者帶了也只會看到自己。recent_limit 沒帶就用 app.usage.default-recent-limit */
    @GetMapping
    public ProfileResponse profile(@RequestParam(value = "user", required = false) String user,
                                   @RequestParam(value = "recent_limit", required = false) Integer recentLimit) {
        var d = policy.authorize(RouteClass.PROFILE_USAGE, auth.requirePrincipal(), user);
        return profiles.profile(d.effectiveUserId(), recentLimit);
    }

    @GetMapping("/keys")
    public List<ApiKeyView> keys(@RequestParam(value = "user", required = false) String user) {
        var d = policy.authorize(RouteClass.PROFILE_USAGE, auth.requirePrincipal(), user);
        return profiles.keys(d.effectiveUserId());
    }
}

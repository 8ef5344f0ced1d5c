package com.anyllm.gateway.auth.policy;

import com.anyllm.gateway.auth.security.CredentialKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * 路由分類 → 可用的憑證種類、master 是否必須指定 user。
 */
public enum RouteClass {

    /** 用量回報、預算檢查 */
    USER_CALL(EnumSet.allOf(CredentialKind.class), true),

    /** /v1/users/me：只有真正的使用者才有「自己」 */
    SELF_INFO(EnumSet.of(CredentialKind.API_KEY, CredentialKind.ACCESS_TOKEN), false),

    /** /v1/admin/** */
    ADMIN(EnumSet.of(CredentialKind.MASTER), false),

    /** /v1/profile/** */
    PROFILE_USAGE(EnumSet.allOf(CredentialKind.class), true);

    private final Set<CredentialKind> allowed;
    private final boolean masterNeedsTarget;

    RouteClass(Set<CredentialKind> allowed, boolean masterNeedsTarget) {
        this.allowed = allowed;
        this.masterNeedsTarget = masterNeedsTarget;
    }

    public boolean allows(CredentialKind kind) {
        return allowed.contains(kind);
    }

    public boolean masterNeedsTarget() {
        return masterNeedsTarget;
    }
}

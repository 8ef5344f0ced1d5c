package com.anyllm.gateway.admin.controller;

import com.anyllm.gateway.admin.dto.BlockUserRequest;
import com.anyllm.gateway.admin.dto.CreateApiKeyRequest;
import com.anyllm.gateway.admin.dto.CreatedApiKeyResponse;
import com.anyllm.gateway.admin.service.AdminUserService;
import com.anyllm.gateway.auth.policy.AccessPolicy;
import com.anyllm.gateway.auth.policy.RouteClass;
import com.anyllm.gateway.auth.security.AuthContext;
import com.anyllm.gateway.auth.service.ApiKeyService;
import com.anyllm.gateway.users.dto.ApiKeyView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 只接受 master key。
 */
@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AuthContext auth;
    private final AccessPolicy policy;
    private final ApiKeyService apiKeys;
    private final AdminUserService adminUsers;

    @PostMapping("/users/{userId}/keys")
    public ResponseEntity<CreatedApiKeyResponse> createKey(@PathVariable String userId,
                                                           @Valid @RequestBody(required = false) CreateApiKeyRequest body) {
        requireAdmin();
        var req = (body == null) ? new CreateApiKeyRequest(null, null, null) : body;
        var issued = apiKeys.createForExistingUser(userId, req.keyName(), req.expiresAt(), req.metadata());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CreatedApiKeyResponse(ApiKeyView.of(issued.key()), issued.plaintext()));
    }

    @DeleteMapping("/keys/{keyId}")
    public ResponseEntity<Void> deactivateKey(@PathVariable String keyId) {
        requireAdmin();
        apiKeys.deactivate(keyId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/users/{userId}/blocked")
    public Map<String, Object> setBlocked(@PathVariable String userId, @Valid @RequestBody BlockUserRequest body) {
        requireAdmin();
        adminUsers.setBlocked(userId, body.blocked());
        return Map.of("user_id", userId, "blocked", body.blocked());
    }

    @PostMapping("/users/{userId}/sessions/revoke")
    public Map<String, Object> revokeSessions(@PathVariable String userId) {
        requireAdmin();
        int n = adminUsers.revokeSessions(userId);
        return Map.of("user_id", userId, "revoked", n);
    }

    private void requireAdmin() {
        policy.authorize(RouteClass.ADMIN, auth.requirePrincipal(), null);
    }
}

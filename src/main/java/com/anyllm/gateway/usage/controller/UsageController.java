package com.anyllm.gateway.usage.controller;

import com.anyllm.gateway.auth.policy.AccessDecision;
import com.anyllm.gateway.auth.policy.AccessPolicy;
import com.anyllm.gateway.auth.policy.RouteClass;
import com.anyllm.gateway.auth.security.AuthContext;
import com.anyllm.gateway.auth.security.Principal;
import com.anyllm.gateway.usage.dto.BudgetStatus;
import com.anyllm.gateway.usage.dto.UsageEventRequest;
import com.anyllm.gateway.usage.dto.UsageLogView;
import com.anyllm.gateway.usage.service.UsageLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 下游路由層的入帳點：呼叫前 budget-check，呼叫後回報 events。
 */
@RestController
@RequestMapping("/v1/usage")
@RequiredArgsConstructor
public class UsageController {

    private final AuthContext auth;
    private final AccessPolicy policy;
    private final UsageLedger ledger;

    @GetMapping("/budget-check")
    public BudgetStatus budgetCheck(@RequestParam(value = "user", required = false) String user) {
        AccessDecision d = policy.authorize(RouteClass.USER_CALL, auth.requirePrincipal(), user);
        return ledger.checkBudget(d.effectiveUserId());
    }

    @PostMapping("/events")
    public ResponseEntity<UsageLogView> record(@RequestParam(value = "user", required = false) String user,
                                               @Valid @RequestBody UsageEventRequest body) {
        Principal p = auth.requirePrincipal();
        AccessDecision d = policy.authorize(RouteClass.USER_CALL, p, user);
        // master 代記時沒有 api key
        var row = ledger.recordUsage(d.effectiveUserId(), d.actingAsMaster() ? null : p.apiKeyId(), body);
        return ResponseEntity.status(HttpStatus.CREATED).body(UsageLogView.of(row));
    }
}

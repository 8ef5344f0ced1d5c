package com.anyllm.gateway.auth.policy;

/**
 * @param effectiveUserId 要計費/查詢的 user；ADMIN 路由為 null
 * @param actingAsMaster  是否以 master 身分代為操作
 */
public record AccessDecision(String effectiveUserId, boolean actingAsMaster) {}

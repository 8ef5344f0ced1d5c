package com.anyllm.gateway.auth.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 跟著 session 列存的裝置資訊；原樣存入，不做解讀。
 */
public record SessionMetadata(
        String deviceType,
        String deviceId,
        String os,
        String appVersion,
        String userAgent,
        String ip,
        Map<String, Object> metadata
) {

    public static SessionMetadata empty() {
        return new SessionMetadata(null, null, null, null, null, null, Map.of());
    }

    /** 旋轉時：沿用舊值，新請求有帶的欄位覆蓋 */
    public SessionMetadata overriddenBy(SessionMetadata newer) {
        if (newer == null) return this;
        Map<String, Object> merged = new LinkedHashMap<>();
        if (metadata != null) merged.putAll(metadata);
        if (newer.metadata() != null) merged.putAll(newer.metadata());
        return new SessionMetadata(
                pick(newer.deviceType(), deviceType),
                pick(newer.deviceId(), deviceId),
                pick(newer.os(), os),
                pick(newer.appVersion(), appVersion),
                pick(newer.userAgent(), userAgent),
                pick(newer.ip(), ip),
                merged
        );
    }

    /** user_agent / ip 沒帶就用 HTTP 請求本身的值 */
    public SessionMetadata withFallback(String fallbackUserAgent, String fallbackIp) {
        return new SessionMetadata(deviceType, deviceId, os, appVersion,
                pick(userAgent, fallbackUserAgent), pick(ip, fallbackIp), metadata);
    }

    private static String pick(String preferred, String fallback) {
        return (preferred == null || preferred.isBlank()) ? fallback : preferred;
    }
}

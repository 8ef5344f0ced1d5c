package com.anyllm.gateway.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * 每個請求一個 rid：放 request attribute、MDC（log pattern 會印）、回應 header。
 * 排在 security chain 前面，401 也帶得到。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final int MAX_LEN = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = sanitize(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }

    // 外部帶進來的值會進 log，長度與字元都要限制
    private static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) return UUID.randomUUID().toString();
        String s = raw.trim();
        if (s.length() > MAX_LEN || !s.matches("[A-Za-z0-9._:-]+")) return UUID.randomUUID().toString();
        return s;
    }
}

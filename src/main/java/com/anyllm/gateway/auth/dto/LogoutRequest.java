package com.anyllm.gateway.auth.dto;

public record LogoutRequest(String refreshToken) {}

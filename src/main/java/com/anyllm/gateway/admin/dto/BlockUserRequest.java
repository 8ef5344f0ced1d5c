package com.anyllm.gateway.admin.dto;

import jakarta.validation.constraints.NotNull;

public record BlockUserRequest(@NotNull Boolean blocked) {}

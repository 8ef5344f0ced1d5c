package com.anyllm.gateway.users.dto;

import com.anyllm.gateway.auth.dto.BudgetView;
import com.anyllm.gateway.auth.dto.UserView;
import com.anyllm.gateway.usage.dto.UsageLogView;
import com.anyllm.gateway.usage.dto.UsageWindow;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProfileResponse(
        UserView user,
        BudgetView budget,
        Usage usage,
        List<UsageLogView> recentUsage
) {
    public record Usage(
            @JsonProperty("last_24h") UsageWindow last24h,
            @JsonProperty("last_7d") UsageWindow last7d,
            @JsonProperty("last_30d") UsageWindow last30d
    ) {}
}

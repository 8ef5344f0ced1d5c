package com.anyllm.gateway.users.controller;

import com.anyllm.gateway.auth.config.SecurityConfig;
import com.anyllm.gateway.auth.entity.GatewayUser;
import com.anyllm.gateway.auth.policy.AccessPolicy;
import com.anyllm.gateway.auth.security.AuthContext;
import com.anyllm.gateway.auth.security.CredentialResolver;
import com.anyllm.gateway.auth.security.Principal;
import com.anyllm.gateway.auth.web.AuthErrorCode;
import com.anyllm.gateway.auth.web.AuthException;
import com.anyllm.gateway.users.service.ProfileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = UserMeController.class)
@Import({SecurityConfig.class, AuthContext.class, AccessPolicy.class})
class UserMeControllerWebTest {

    @Autowired MockMvc mvc;

    @MockitoBean CredentialResolver resolver;
    @MockitoBean ProfileService profiles;

    @Test
    void me_with_api_key_returns_user() throws Exception {
        when(resolver.resolve("Bearer gw-ok")).thenReturn(Principal.apiKey("u-1", "k-1"));
        GatewayUser u = new GatewayUser();
        u.setUserId("u-1");
        u.setBudgetId("b-1");
        when(profiles.requireUser("u-1")).thenReturn(u);

        mvc.perform(get("/v1/users/me").header("X-AnyLLM-Key", "Bearer gw-ok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value("u-1"))
                .andExpect(jsonPath("$.api_key_id").value("k-1"))
                .andExpect(jsonPath("$.budget_id").value("b-1"));
    }

    @Test
    void resolver_failure_is_written_by_the_filter() throws Exception {
        when(resolver.resolve(any())).thenThrow(new AuthException(AuthErrorCode.INVALID_CREDENTIAL));

        mvc.perform(get("/v1/users/me").header("X-AnyLLM-Key", "Bearer nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIAL"))
                .andExpect(jsonPath("$.message").value("Invalid credential"));

        verifyNoInteractions(profiles);
    }

    @Test
    void master_on_self_info_is_forbidden() throws Exception {
        when(resolver.resolve("Bearer sk-master")).thenReturn(Principal.master());

        mvc.perform(get("/v1/users/me").header("X-AnyLLM-Key", "Bearer sk-master"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void unknown_user_maps_to_404() throws Exception {
        when(resolver.resolve("Bearer gw-ok")).thenReturn(Principal.apiKey("u-gone", "k-1"));
        when(profiles.requireUser("u-gone")).thenThrow(new AuthException(AuthErrorCode.USER_NOT_FOUND));

        mvc.perform(get("/v1/users/me").header("X-AnyLLM-Key", "Bearer gw-ok"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }
}

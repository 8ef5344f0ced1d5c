package com.anyllm.gateway;

import com.anyllm.gateway.testsupport.BaseSpringTest;
import com.anyllm.gateway.testsupport.TestGatewayConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 端到端：social-login → 各種憑證打各路由 → refresh / logout。
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestGatewayConfig.class)
class AuthFlowIntegrationTest extends BaseSpringTest {

    private static final String HEADER = "X-AnyLLM-Key";
    private static final String MASTER = "Bearer sk-master-test";

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;

    private JsonNode socialLogin(String subject) throws Exception {
        MvcResult r = mvc.perform(post("/v1/auth/social-login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"provider":"google","access_token":"tok-%s","device_type":"ios","app_version":"3.1.0"}
                                """.formatted(subject)))
                .andExpect(status().isOk())
                .andReturn();
        return om.readTree(r.getResponse().getContentAsString());
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    @Test
    void new_google_user_gets_key_once_and_profile_never_shows_it() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());

        assertThat(login.get("is_new_user").asBoolean()).isTrue();
        assertThat(login.get("budget").get("spend").decimalValue()).isZero();
        String apiKey = login.get("api_key").asText();
        assertThat(apiKey).startsWith("gw-");

        MvcResult keys = mvc.perform(get("/v1/profile/keys")
                        .header(HEADER, bearer(login.get("access_token").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].key_name").value("social-login"))
                .andExpect(jsonPath("$[0].is_active").value(true))
                .andExpect(jsonPath("$[0].key_hash").doesNotExist())
                .andReturn();
        assertThat(keys.getResponse().getContentAsString()).doesNotContain(apiKey);
    }

    @Test
    void repeat_login_returns_same_user_and_no_plaintext() throws Exception {
        String subject = UUID.randomUUID().toString();
        JsonNode first = socialLogin(subject);
        JsonNode again = socialLogin(subject);

        assertThat(again.get("is_new_user").asBoolean()).isFalse();
        assertThat(again.has("api_key")).isFalse();
        assertThat(again.get("user").get("user_id").asText()).isEqualTo(first.get("user").get("user_id").asText());
        assertThat(again.get("budget").get("budget_id").asText()).isEqualTo(first.get("budget").get("budget_id").asText());
        assertThat(again.get("access_token").asText()).isNotEqualTo(first.get("access_token").asText());
    }

    @Test
    void api_key_and_access_token_both_resolve_to_the_user() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());
        String userId = login.get("user").get("user_id").asText();

        mvc.perform(get("/v1/users/me").header(HEADER, bearer(login.get("api_key").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(userId))
                .andExpect(jsonPath("$.credential_kind").value("API_KEY"));

        mvc.perform(get("/v1/auth/me").header(HEADER, bearer(login.get("access_token").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(userId))
                .andExpect(jsonPath("$.credential_kind").value("ACCESS_TOKEN"));
    }

    @Test
    void header_failures_are_json_401_with_request_id() throws Exception {
        mvc.perform(get("/v1/users/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("MALFORMED_CREDENTIAL"))
                .andExpect(jsonPath("$.requestId").exists());

        mvc.perform(get("/v1/users/me").header(HEADER, "Bearer gw-nope").header("X-Request-Id", "rid-123"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-Request-Id", "rid-123"))
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIAL"))
                .andExpect(jsonPath("$.requestId").value("rid-123"));
    }

    @Test
    void master_key_route_policy() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());
        String userId = login.get("user").get("user_id").asText();

        mvc.perform(get("/v1/profile").header(HEADER, MASTER))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TARGET_USER_REQUIRED"));

        mvc.perform(get("/v1/profile").param("user", userId).param("recent_limit", "5").header(HEADER, MASTER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.user_id").value(userId))
                .andExpect(jsonPath("$.budget.budget_id").value(login.get("budget").get("budget_id").asText()))
                .andExpect(jsonPath("$.usage.last_24h.requests").value(0))
                .andExpect(jsonPath("$.recent_usage").isArray());

        mvc.perform(get("/v1/users/me").header(HEADER, MASTER))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        mvc.perform(delete("/v1/admin/keys/whatever").header(HEADER, bearer(login.get("api_key").asText())))
                .andExpect(status().isForbidden());
    }

    @Test
    void non_master_target_parameter_is_ignored() throws Exception {
        JsonNode alice = socialLogin(UUID.randomUUID().toString());
        JsonNode bob = socialLogin(UUID.randomUUID().toString());

        mvc.perform(get("/v1/profile")
                        .param("user", bob.get("user").get("user_id").asText())
                        .header(HEADER, bearer(alice.get("access_token").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.user_id").value(alice.get("user").get("user_id").asText()));
    }

    @Test
    void recent_limit_out_of_range_is_400() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());

        mvc.perform(get("/v1/profile").param("recent_limit", "101")
                        .header(HEADER, bearer(login.get("access_token").asText())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("RECENT_LIMIT_OUT_OF_RANGE"));
    }

    @Test
    void logout_kills_access_token_but_keeps_api_key() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());
        String access = bearer(login.get("access_token").asText());

        mvc.perform(post("/v1/auth/logout").header(HEADER, access))
                .andExpect(status().isNoContent());

        mvc.perform(get("/v1/users/me").header(HEADER, access))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REVOKED_OR_UNKNOWN_SESSION"));

        // 再登出一次仍是 204
        mvc.perform(post("/v1/auth/logout").header(HEADER, access))
                .andExpect(status().isNoContent());

        mvc.perform(get("/v1/users/me").header(HEADER, bearer(login.get("api_key").asText())))
                .andExpect(status().isOk());
    }

    @Test
    void logout_by_refresh_token_body_without_header() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());

        mvc.perform(post("/v1/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refresh_token\":\"%s\"}".formatted(login.get("refresh_token").asText())))
                .andExpect(status().isNoContent());

        mvc.perform(post("/v1/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refresh_token\":\"%s\"}".formatted(login.get("refresh_token").asText())))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void refresh_replay_is_detected_and_poisons_the_successor() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());
        String body = "{\"refresh_token\":\"%s\"}".formatted(login.get("refresh_token").asText());

        MvcResult first = mvc.perform(post("/v1/auth/refresh").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("Bearer"))
                .andReturn();
        JsonNode rotated = om.readTree(first.getResponse().getContentAsString());

        mvc.perform(post("/v1/auth/refresh").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REFRESH_REUSE_DETECTED"));

        mvc.perform(post("/v1/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refresh_token\":\"%s\"}".formatted(rotated.get("refresh_token").asText())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REFRESH_REUSE_DETECTED"));

        mvc.perform(get("/v1/users/me").header(HEADER, bearer(rotated.get("access_token").asText())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REVOKED_OR_UNKNOWN_SESSION"));
    }

    @Test
    void login_validation_and_provider_errors() throws Exception {
        mvc.perform(post("/v1/auth/social-login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"google\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        mvc.perform(post("/v1/auth/social-login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"myspace\",\"access_token\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_PROVIDER"));

        mvc.perform(post("/v1/auth/social-login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"google\",\"access_token\":\"bad\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("PROFILE_VERIFICATION_FAILED"));
    }

    @Test
    void usage_accrual_and_budget_gate() throws Exception {
        JsonNode login = socialLogin(UUID.randomUUID().toString());
        String key = bearer(login.get("api_key").asText());

        mvc.perform(get("/v1/usage/budget-check").header(HEADER, key))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true));

        mvc.perform(post("/v1/usage/events").header(HEADER, key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"model":"gpt-4o","provider":"openai","prompt_tokens":10,"completion_tokens":5,"cost":10.00}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.total_tokens").value(15))
                .andExpect(jsonPath("$.api_key_id").isNotEmpty());

        mvc.perform(get("/v1/usage/budget-check").header(HEADER, key))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("BUDGET_EXCEEDED"));

        mvc.perform(get("/v1/profile").header(HEADER, key))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.usage.last_24h.requests").value(1))
                .andExpect(jsonPath("$.recent_usage.length()").value(1));
    }

    @Test
    void admin_surface() throws Exception {
        String subject = UUID.randomUUID().toString();
        JsonNode login = socialLogin(subject);
        String userId = login.get("user").get("user_id").asText();

        MvcResult created = mvc.perform(post("/v1/admin/users/{id}/keys", userId).header(HEADER, MASTER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key_name\":\"ci\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.key.key_name").value("ci"))
                .andReturn();
        JsonNode key = om.readTree(created.getResponse().getContentAsString());
        String plaintext = key.get("api_key").asText();

        mvc.perform(get("/v1/users/me").header(HEADER, bearer(plaintext)))
                .andExpect(status().isOk());

        mvc.perform(delete("/v1/admin/keys/{id}", key.get("key").get("id").asText()).header(HEADER, MASTER))
                .andExpect(status().isNoContent());
        mvc.perform(get("/v1/users/me").header(HEADER, bearer(plaintext)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIAL"));

        mvc.perform(post("/v1/admin/users/{id}/sessions/revoke", userId).header(HEADER, MASTER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(1));
        mvc.perform(get("/v1/users/me").header(HEADER, bearer(login.get("access_token").asText())))
                .andExpect(status().isUnauthorized());

        mvc.perform(put("/v1/admin/users/{id}/blocked", userId).header(HEADER, MASTER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"blocked\":true}"))
                .andExpect(status().isOk());
        mvc.perform(post("/v1/auth/social-login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"google\",\"access_token\":\"tok-%s\"}".formatted(subject)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("USER_BLOCKED"));

        mvc.perform(post("/v1/admin/users/{id}/keys", "missing-user").header(HEADER, MASTER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }

    @Test
    void oversized_profile_hint_is_rejected_before_provisioning() throws Exception {
        mvc.perform(post("/v1/auth/social-login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"google\",\"access_token\":\"anon-%s\",\"name\":\"%s\"}"
                                .formatted(UUID.randomUUID(), "n".repeat(121))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }
}

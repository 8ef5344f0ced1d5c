package com.anyllm.gateway.auth.verify;

import com.anyllm.gateway.config.GatewayAuthProperties;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdToken;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdTokenVerifier;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Google ID token 驗簽（aud 必須是設定的 client id 之一）。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.auth.google", name = "enabled", havingValue = "true")
public class GoogleProfileVerifier implements ProfileVerifier {

    public static final String PROVIDER = "google";

    private final GoogleIdTokenVerifier verifier;

    public GoogleProfileVerifier(GatewayAuthProperties props) {
        var clientIds = props.getGoogle().getClientIds();
        if (clientIds == null || clientIds.isEmpty()) {
            throw new IllegalStateException(
                    "Missing app.auth.google.client-ids while app.auth.google.enabled=true"
            );
        }
        this.verifier = new GoogleIdTokenVerifier
                .Builder(new NetHttpTransport(), GsonFactory.getDefaultInstance())
                .setAudience(clientIds)
                .build();
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public VerifiedProfile verify(String idTokenString) throws Exception {
        GoogleIdToken idToken = verifier.verify(idTokenString);
        if (idToken == null) {
            log.debug("google id token rejected");
            return null;
        }

        var p = idToken.getPayload();
        Long exp = p.getExpirationTimeSeconds();
        return new VerifiedProfile(
                PROVIDER,
                p.getSubject(),
                p.getEmail(),
                (String) p.get("name"),
                (String) p.get("picture"),
                VerifiedProfile.DEFAULT_ROLE,
                exp == null ? null : Instant.ofEpochSecond(exp)
        );
    }
}

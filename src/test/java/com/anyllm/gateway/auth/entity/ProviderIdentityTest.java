package com.anyllm.gateway.auth.entity;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderIdentityTest {

    @Test
    void email_is_trimmed_and_lower_cased_independent_of_default_locale() {
        Locale before = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ProviderIdentity identity = new ProviderIdentity();
            identity.setEmail("  IRIS.KIM@EXAMPLE.COM ");

            assertThat(identity.getEmail()).isEqualTo("iris.kim@example.com");
        } finally {
            Locale.setDefault(before);
        }
    }

    @Test
    void null_email_stays_null() {
        ProviderIdentity identity = new ProviderIdentity();
        identity.setEmail(null);

        assertThat(identity.getEmail()).isNull();
    }
}

package com.anyllm.gateway.common.crypto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashesTest {

    @Test
    void sha256_hex_should_match_known_vector() {
        assertThat(Hashes.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void sha256_hex_should_be_64_lowercase_chars() {
        assertThat(Hashes.sha256Hex("gw-anything")).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void sha256_hex_null_should_throw() {
        assertThatThrownBy(() -> Hashes.sha256Hex(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constant_time_equals_cases() {
        assertThat(Hashes.constantTimeEquals("sk-master", "sk-master")).isTrue();
        assertThat(Hashes.constantTimeEquals("sk-master", "sk-masteR")).isFalse();
        assertThat(Hashes.constantTimeEquals("sk-master", "sk-master-longer")).isFalse();
        assertThat(Hashes.constantTimeEquals(null, "x")).isFalse();
    }
}

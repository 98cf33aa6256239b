package com.devgate.security.testing;

import com.devgate.security.SigningKeySet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TestTokenFactory")
class TestTokenFactoryTest {

    private static final TestTokenFactory KEY_A = new TestTokenFactory("key-a");
    private static final TestTokenFactory KEY_B = new TestTokenFactory("key-b");

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("JWKS lists every factory's public key as an RS256 signing key")
    void jwksDocument() throws Exception {
        JsonNode keys = mapper.readTree(TestTokenFactory.jwks(KEY_A, KEY_B)).get("keys");

        assertThat(keys).hasSize(2);
        JsonNode first = keys.get(0);
        assertThat(first.get("kty").asText()).isEqualTo("RSA");
        assertThat(first.get("kid").asText()).isEqualTo("key-a");
        assertThat(first.get("alg").asText()).isEqualTo("RS256");
        assertThat(first.get("use").asText()).isEqualTo("sig");
        assertThat(first.has("d")).isFalse();
    }

    @Test
    @DisplayName("JWKS round-trips into a signing key set with the factory's key")
    void jwksParses() {
        SigningKeySet set = SigningKeySet.parse(TestTokenFactory.jwks(KEY_A, KEY_B), Instant.now().plusSeconds(60));

        assertThat(set.keyIds()).containsExactlyInAnyOrder("key-a", "key-b");
        assertThat(set.find("key-b")).isPresent();
    }

    @Test
    @DisplayName("metadata document escapes its values")
    void openIdConfiguration() throws Exception {
        JsonNode document = mapper.readTree(TestTokenFactory.openIdConfiguration(
                "https://issuer.example/\"quoted\"", "https://issuer.example/keys"));

        assertThat(document.get("issuer").asText()).isEqualTo("https://issuer.example/\"quoted\"");
        assertThat(document.get("jwks_uri").asText()).isEqualTo("https://issuer.example/keys");
    }
}

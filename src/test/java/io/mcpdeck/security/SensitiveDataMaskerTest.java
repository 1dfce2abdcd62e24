package io.mcpdeck.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpdeck.util.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensitiveDataMaskerTest {
    @Test
    void sensitiveKeysAreMaskedAtAnyDepth() throws Exception {
        JsonNode input = Jsons.mapper().readTree("{\"name\":\"files\",\"env\":{\"GITHUB_TOKEN\":\"ghp_x\",\"HOME\":\"/home/u\"},"
                + "\"list\":[{\"password\":\"hunter2\"}]}");

        JsonNode masked = SensitiveDataMasker.masked(input);

        assertEquals("files", masked.path("name").asText());
        assertEquals(SensitiveDataMasker.MASK, masked.path("env").path("GITHUB_TOKEN").asText());
        assertEquals("/home/u", masked.path("env").path("HOME").asText());
        assertEquals(SensitiveDataMasker.MASK, masked.path("list").get(0).path("password").asText());
        assertEquals("ghp_x", input.path("env").path("GITHUB_TOKEN").asText());
    }

    @Test
    void longOpaqueValuesAreMasked() throws Exception {
        JsonNode masked = SensitiveDataMasker.masked(
                Jsons.mapper().readTree("{\"note\":\"sk-abcdefghijklmnopqrstuvwxyz0123\",\"path\":\"/usr/local/bin/server\"}"));

        assertEquals(SensitiveDataMasker.MASK, masked.path("note").asText());
        assertEquals("/usr/local/bin/server", masked.path("path").asText());
    }

    @Test
    void envMaskingLooksOnlyAtKeys() throws Exception {
        JsonNode masked = SensitiveDataMasker.maskedEnv(
                Jsons.mapper().readTree("{\"API_KEY\":\"x\",\"DATA_DIR\":\"/very/long/path/that/looks/opaque/to/heuristics\"}"));

        assertEquals(SensitiveDataMasker.MASK, masked.path("API_KEY").asText());
        assertEquals("/very/long/path/that/looks/opaque/to/heuristics", masked.path("DATA_DIR").asText());
        assertTrue(SensitiveDataMasker.maskedEnv(null).isEmpty());
    }

    @Test
    void flagValuesAreMaskedInArgs() throws Exception {
        JsonNode masked = SensitiveDataMasker.maskedArgs(
                Jsons.mapper().readTree("[\"-y\",\"@scope/server\",\"--password\",\"p\",\"--auth-token=t\",\"--port\",\"9\"]"));

        assertEquals("[\"-y\",\"@scope/server\",\"--password\",\"********\",\"--auth-token=********\",\"--port\",\"9\"]",
                Jsons.toCompactJson(masked));
        assertTrue(SensitiveDataMasker.maskedArgs(null).isEmpty());
    }

    @Test
    void keyHintsAreCaseInsensitive() {
        assertTrue(SensitiveDataMasker.isSensitiveKey("Authorization"));
        assertTrue(SensitiveDataMasker.isSensitiveKey("DB_PASSWORD"));
        assertFalse(SensitiveDataMasker.isSensitiveKey("command"));
        assertFalse(SensitiveDataMasker.isSensitiveKey(""));
    }
}

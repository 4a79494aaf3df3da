package io.zendesk.sdk;

import io.zendesk.sdk.auth.Credential;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void derivesBaseUrlFromSubdomain() {
        Config config = Config.builder()
            .subdomain("acme")
            .build();

        assertEquals("https://acme.zendesk.com/api/v2", config.getBaseUrl());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertNotNull(config.getHttpClient());
        assertNull(config.getCredential());
    }

    @Test
    void appliesDefaultHeaders() {
        Config config = Config.builder()
            .subdomain("acme")
            .build();

        assertEquals("application/json", config.getHeaders().get("Content-Type"));
        assertEquals("zendesk-java-sdk/" + Config.SDK_VERSION, config.getHeaders().get("User-Agent"));
    }

    @Test
    void customHeaderReplacesDefaultIgnoringCase() {
        Config config = Config.builder()
            .subdomain("acme")
            .header("USER-AGENT", "custom/1.0")
            .build();

        assertEquals(2, config.getHeaders().size());
        assertEquals("custom/1.0", config.getHeaders().get("user-agent"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Acme", "ac_me", "-acme", "acme-", "a", "ab", "", "acme.com"})
    void rejectsInvalidSubdomains(String subdomain) {
        Config.Builder builder = Config.builder().subdomain(subdomain);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(ex.getMessage().contains("invalid subdomain"));
        assertFalse(Config.isValidSubdomain(subdomain));
    }

    @ParameterizedTest
    @ValueSource(strings = {"acme", "my-company", "a1b", "123", "support-team-2"})
    void acceptsValidSubdomains(String subdomain) {
        assertTrue(Config.isValidSubdomain(subdomain));
        assertEquals("https://" + subdomain + ".zendesk.com/api/v2",
            Config.builder().subdomain(subdomain).build().getBaseUrl());
    }

    @Test
    void endpointUrlOverridesSubdomainWithoutValidation() {
        Config config = Config.builder()
            .subdomain("Not_Valid")
            .endpointUrl("http://127.0.0.1:8080/api/v2/")
            .build();

        assertEquals("http://127.0.0.1:8080/api/v2", config.getBaseUrl());
    }

    @Test
    void rejectsEndpointWithoutHost() {
        Config.Builder builder = Config.builder().endpointUrl("invalid");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void requiresSubdomainOrEndpoint() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().build());
    }

    @Test
    void invalidSubdomainFailsBeforeClientExists() {
        Config.Builder builder = Config.builder()
            .subdomain("Bad_Tenant")
            .credential(Credential.bearer("token"));

        assertThrows(IllegalArgumentException.class, () -> new ZendeskClient(builder.build()));
    }

    @Test
    void honoursCustomTimeoutAndIgnoresNonPositive() {
        Config custom = Config.builder()
            .subdomain("acme")
            .httpTimeout(Duration.ofSeconds(5))
            .build();
        Config zero = Config.builder()
            .subdomain("acme")
            .httpTimeout(Duration.ZERO)
            .build();

        assertEquals(Duration.ofSeconds(5), custom.getHttpTimeout());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, zero.getHttpTimeout());
    }

    @Test
    void withDefaultsIsIdempotent() {
        Config config = Config.builder()
            .subdomain("acme")
            .header("X-Trace", "1")
            .build();

        Config again = config.withDefaults();

        assertEquals(config.getBaseUrl(), again.getBaseUrl());
        assertEquals(config.getHeaders(), again.getHeaders());
        assertSame(config.getHttpClient(), again.getHttpClient());
    }
}

package com.z254.robi.session;

import com.z254.robi.config.RobiProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ApiKeyAuthenticator}.
 */
class ApiKeyAuthenticatorTest {

    private static ApiKeyAuthenticator authenticatorWithKey(String key) {
        RobiProperties robiProperties = new RobiProperties();
        robiProperties.getSession().setApiKey(key);
        return new ApiKeyAuthenticator(robiProperties);
    }

    @Test
    @DisplayName("should accept only the configured key")
    void acceptConfiguredKey() {
        ApiKeyAuthenticator authenticator = authenticatorWithKey("s3cret");

        assertThat(authenticator.isValid("s3cret")).isTrue();
        assertThat(authenticator.isValid("S3CRET")).isFalse();
        assertThat(authenticator.isValid("s3cret ")).isFalse();
        assertThat(authenticator.isValid("")).isFalse();
        assertThat(authenticator.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("should refuse everyone when no key is configured")
    void refuseWithoutKey() {
        assertThat(authenticatorWithKey(null).isValid("anything")).isFalse();
        assertThat(authenticatorWithKey("  ").isValid("  ")).isFalse();
    }
}

package com.z254.robi.session;

import com.z254.robi.config.RobiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the key a device presents in its {@code auth} message. With no key configured
 * every attempt is refused.
 */
@Slf4j
@Component
public class ApiKeyAuthenticator {

    private final RobiProperties robiProperties;

    public ApiKeyAuthenticator(RobiProperties robiProperties) {
        this.robiProperties = robiProperties;
    }

    public boolean isValid(String presentedKey) {
        String expected = robiProperties.getSession().getApiKey();
        if (expected == null || expected.isBlank()) {
            log.warn("No session API key configured; refusing authentication");
            return false;
        }
        if (presentedKey == null || presentedKey.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presentedKey.getBytes(StandardCharsets.UTF_8));
    }
}

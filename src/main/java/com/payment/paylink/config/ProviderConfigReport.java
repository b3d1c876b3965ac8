package com.payment.paylink.config;

import com.payment.paylink.compliance.CredentialMasker;
import com.payment.paylink.domain.ProviderId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports provider configuration at startup. A missing key does not stop the
 * service: calls to that provider fail with a config error instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderConfigReport {

    public enum KeyMode { TEST, LIVE, UNKNOWN }

    private final PaylinkProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void logReport() {
        log.info("App base URL: {}", properties.getApp().getBaseUrl());
        for (ProviderId providerId : ProviderId.values()) {
            ProviderCredentials credentials = properties.credentials(providerId);
            log.info("{} config: baseUrl={} publishableKey={} secretKey={}{}",
                    providerId.getDisplayName(),
                    credentials.getBaseUrl(),
                    CredentialMasker.presence(credentials.getPublishableKey()),
                    CredentialMasker.presence(credentials.getSecretKey()),
                    providerId == ProviderId.ONVO ? " mode=" + keyMode(credentials.getPublishableKey()) : "");
            List<String> problems = validate(providerId);
            if (!problems.isEmpty()) {
                log.warn("Invalid {} configuration: {}", providerId.getDisplayName(), String.join("; ", problems));
            }
        }
    }

    /**
     * Every configuration problem for the provider; empty when it is usable.
     */
    public List<String> validate(ProviderId providerId) {
        ProviderCredentials credentials = properties.credentials(providerId);
        String prefix = "paylink.providers." + providerId.getWireName();
        List<String> errors = new ArrayList<>();
        if (isBlank(credentials.getPublishableKey())) {
            errors.add(prefix + ".publishable-key is required");
        }
        if (isBlank(credentials.getSecretKey())) {
            errors.add(prefix + ".secret-key is required");
        }
        if (providerId == ProviderId.ONVO
                && !isBlank(credentials.getPublishableKey())
                && !isBlank(credentials.getSecretKey())) {
            boolean publishableIsTest = credentials.getPublishableKey().contains("_test_");
            boolean secretIsTest = credentials.getSecretKey().contains("_test_");
            if (publishableIsTest != secretIsTest) {
                errors.add("ONVO keys must be from the same environment (both test or both live)");
            }
        }
        return errors;
    }

    /** ONVO keys embed their environment: {@code onvo_test_...} / {@code onvo_live_...}. */
    public static KeyMode keyMode(String key) {
        if (isBlank(key)) {
            return KeyMode.UNKNOWN;
        }
        if (key.contains("_test_")) {
            return KeyMode.TEST;
        }
        return key.contains("_live_") ? KeyMode.LIVE : KeyMode.UNKNOWN;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

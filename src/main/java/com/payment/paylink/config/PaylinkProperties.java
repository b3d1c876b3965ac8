package com.payment.paylink.config;

import com.payment.paylink.domain.ProviderId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Service configuration, bound once at startup and handed to the HTTP clients
 * and adapters by constructor. Nothing reads the environment after that.
 */
@Validated
@ConfigurationProperties(prefix = "paylink")
@Getter
@Setter
public class PaylinkProperties {

    @Valid
    private final App app = new App();

    private final Http http = new Http();

    @Valid
    private final Providers providers = new Providers();

    /**
     * Credentials for the given processor.
     */
    public ProviderCredentials credentials(ProviderId providerId) {
        switch (providerId) {
            case TILOPAY:
                return providers.getTilopay();
            case ONVO:
                return providers.getOnvo();
            default:
                throw new IllegalArgumentException("No credentials for provider " + providerId);
        }
    }

    @Getter
    @Setter
    public static class App {
        /**
         * Public URL of this service; quick links redirect back under it.
         */
        @NotBlank
        private String baseUrl = "http://localhost:3000";
    }

    @Getter
    @Setter
    public static class Http {
        /**
         * Connect timeout for provider calls. Unset keeps the transport default.
         */
        private Duration connectTimeout;

        /**
         * Read timeout for provider calls. Unset keeps the transport default.
         */
        private Duration readTimeout;
    }

    @Getter
    @Setter
    public static class Providers {
        @Valid
        private final ProviderCredentials tilopay = new ProviderCredentials();

        @Valid
        private final ProviderCredentials onvo = new ProviderCredentials();
    }
}

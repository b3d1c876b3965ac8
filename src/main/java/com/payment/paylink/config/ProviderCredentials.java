package com.payment.paylink.config;

import com.payment.paylink.compliance.CredentialMasker;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

/**
 * Credentials and endpoint for one checkout processor. Only the secret key is
 * sent to the processor; the publishable key is checked by
 * {@link ProviderConfigReport} but never used server-side.
 */
@Getter
@Setter
public class ProviderCredentials {

    /** API root, e.g. https://api.onvopay.com/v1. */
    @NotBlank
    private String baseUrl;

    /** Sent as the bearer token. Missing means every call fails with a config error. */
    private String secretKey;

    private String publishableKey;

    public boolean hasSecretKey() {
        return secretKey != null && !secretKey.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderCredentials(baseUrl=" + baseUrl
                + ", secretKey=" + CredentialMasker.mask(secretKey)
                + ", publishableKey=" + CredentialMasker.mask(publishableKey) + ")";
    }
}

package com.payment.paylink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.paylink.core.ProviderHttpClient;
import com.payment.paylink.domain.ProviderId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;

/**
 * One {@link ProviderHttpClient} per processor, each bound to its own credentials.
 */
@Configuration
public class ProviderClientConfig {

    @Bean
    public ProviderHttpClient tilopayHttpClient(PaylinkProperties properties, ObjectMapper objectMapper) {
        return new ProviderHttpClient(ProviderId.TILOPAY, properties.credentials(ProviderId.TILOPAY),
                providerRestTemplate(properties.getHttp()), objectMapper);
    }

    @Bean
    public ProviderHttpClient onvoHttpClient(PaylinkProperties properties, ObjectMapper objectMapper) {
        return new ProviderHttpClient(ProviderId.ONVO, properties.credentials(ProviderId.ONVO),
                providerRestTemplate(properties.getHttp()), objectMapper);
    }

    /**
     * java.net.http instead of HttpURLConnection: the latter cannot read a 401 body on a streamed POST.
     */
    static RestTemplate providerRestTemplate(PaylinkProperties.Http http) {
        HttpClient.Builder client = HttpClient.newBuilder();
        if (http.getConnectTimeout() != null) {
            client.connectTimeout(http.getConnectTimeout());
        }
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(client.build());
        if (http.getReadTimeout() != null) {
            factory.setReadTimeout(http.getReadTimeout());
        }
        return new RestTemplate(factory);
    }
}

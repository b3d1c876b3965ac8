package com.payment.paylink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.paylink.config.ProviderCredentials;
import com.payment.paylink.domain.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outbound JSON calls to one checkout processor. Adds the bearer credential,
 * serializes the payload and classifies every failure into a
 * {@link PaymentLinkException}:
 * <ul>
 *   <li>missing secret key: {@code PROVIDER_CONFIG}, no network attempt</li>
 *   <li>DNS / connect / read failure: {@code PROVIDER_NETWORK}</li>
 *   <li>non-2xx, or 2xx with an unparsable body: {@code PROVIDER_API}</li>
 * </ul>
 * Stateless apart from its collaborators, so one instance serves concurrent requests.
 */
@Slf4j
public class ProviderHttpClient {

    private final ProviderId providerId;
    private final ProviderCredentials credentials;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public ProviderHttpClient(ProviderId providerId,
                              ProviderCredentials credentials,
                              RestTemplate restTemplate,
                              ObjectMapper objectMapper) {
        this.providerId = providerId;
        this.credentials = credentials;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    /**
     * POST {@code payload} as JSON to {@code baseUrl + path}.
     *
     * @return parsed JSON object returned by the processor (never null)
     */
    public JsonNode post(String path, Map<String, Object> payload) {
        if (!credentials.hasSecretKey()) {
            throw PaymentLinkException.config(providerId.getDisplayName() + " secret key is not configured (paylink.providers."
                    + providerId.getWireName() + ".secret-key)");
        }

        String url = resolve(path);
        String body = writePayload(payload);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credentials.getSecretKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            log.debug("POST {} provider={}", path, providerId);
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (ResourceAccessException e) {
            log.warn("Network error contacting {} on POST {}: {}", providerId.getDisplayName(), path, e.getMessage());
            throw PaymentLinkException.network(
                    "Network error contacting " + providerId.getDisplayName() + ": " + rootMessage(e), e);
        } catch (RestClientResponseException e) {
            throw apiError(path, body, e);
        } catch (RestClientException e) {
            throw PaymentLinkException.unexpected(
                    "Unexpected error calling " + providerId.getDisplayName() + ": " + e.getMessage(), e);
        }

        return parseSuccess(path, response.getBody());
    }

    private String resolve(String path) {
        String base = credentials.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw PaymentLinkException.unexpected("Could not serialize " + providerId.getDisplayName() + " payload", e);
        }
    }

    private JsonNode parseSuccess(String path, String raw) {
        JsonNode node = readObject(raw);
        if (node == null) {
            log.error("[{}] malformed response on POST {}: {}", providerId, path, raw);
            throw PaymentLinkException.api(
                    providerId.getDisplayName() + " API error: malformed response", null, null);
        }
        return node;
    }

    private PaymentLinkException apiError(String path, String payload, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        String statusText = e.getStatusText();
        String raw = e.getResponseBodyAsString();

        log.error("[{}] {} {} on POST {}\nBody sent: {}\nResponse: {}",
                providerId, status, statusText, path, payload, raw);

        JsonNode errorBody = readObject(raw);
        String message = errorBody != null ? extractMessage(errorBody) : null;
        if (message == null) {
            if (raw != null && !raw.isBlank()) {
                message = raw;
            } else if (statusText != null && !statusText.isBlank()) {
                message = statusText;
            } else {
                message = "Unknown error";
            }
        }
        String code = errorBody != null ? extractCode(errorBody) : null;

        return PaymentLinkException.api(
                providerId.getDisplayName() + " API error (" + status + "): " + message, status, code);
    }

    /**
     * {@code message} (a string or an array of strings), falling back to {@code error}.
     */
    private static String extractMessage(JsonNode body) {
        JsonNode message = body.get("message");
        if (message != null && message.isArray()) {
            List<String> parts = new ArrayList<>();
            message.forEach(m -> parts.add(m.asText()));
            if (!parts.isEmpty()) {
                return String.join("; ", parts);
            }
        } else if (message != null && message.isValueNode() && !message.isNull()) {
            return message.asText();
        }
        JsonNode error = body.get("error");
        if (error != null && error.isValueNode() && !error.isNull()) {
            return error.asText();
        }
        return null;
    }

    /** TiloPay uses {@code code}, ONVO {@code apiCode}. */
    private static String extractCode(JsonNode body) {
        for (String field : new String[] {"code", "apiCode"}) {
            JsonNode code = body.get(field);
            if (code != null && code.isValueNode() && !code.isNull()) {
                return code.asText();
            }
        }
        return null;
    }

    private JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("[{}] response is not JSON: {}", providerId, e.getOriginalMessage());
            return null;
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t.getMessage() != null && !t.getMessage().isBlank() ? t.getMessage() : ex.getMessage();
    }
}

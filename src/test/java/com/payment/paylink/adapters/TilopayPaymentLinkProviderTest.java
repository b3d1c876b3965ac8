package com.payment.paylink.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.paylink.config.ProviderCredentials;
import com.payment.paylink.core.PaymentLinkException;
import com.payment.paylink.core.ProviderHttpClient;
import com.payment.paylink.domain.BillingInterval;
import com.payment.paylink.domain.CurrencyCode;
import com.payment.paylink.domain.ErrorKind;
import com.payment.paylink.domain.NormalizedPaymentRequest;
import com.payment.paylink.domain.PaymentLinkResult;
import com.payment.paylink.domain.PaymentType;
import com.payment.paylink.domain.ProviderId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TilopayPaymentLinkProviderTest {

    private static final String BASE_URL = "https://api.tilopay.test/v1";

    private MockRestServiceServer server;
    private ProviderCredentials credentials;
    private TilopayPaymentLinkProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        credentials = new ProviderCredentials();
        credentials.setBaseUrl(BASE_URL);
        credentials.setSecretKey("tp_secret");
        provider = new TilopayPaymentLinkProvider(
                new ProviderHttpClient(ProviderId.TILOPAY, credentials, restTemplate, new ObjectMapper()));
    }

    private static NormalizedPaymentRequest.NormalizedPaymentRequestBuilder request() {
        return NormalizedPaymentRequest.builder()
                .amountMinor(1000)
                .currency(CurrencyCode.USD)
                .paymentType(PaymentType.ONE_TIME)
                .successUrl("https://shop.example/success")
                .cancelUrl("https://shop.example/cancel");
    }

    @Test
    void oneTimeLinkIsASingleCallReturningTheUrl() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/payment_intents"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer tp_secret"))
                .andExpect(content().json("{\"amount\":1000,\"currency\":\"USD\","
                        + "\"success_url\":\"https://shop.example/success\","
                        + "\"cancel_url\":\"https://shop.example/cancel\"}", true))
                .andRespond(withSuccess("{\"url\":\"https://pay.example/abc\"}", MediaType.APPLICATION_JSON));

        PaymentLinkResult result = provider.createOneTimePaymentLink(request().build());

        assertThat(result.getUrl()).isEqualTo("https://pay.example/abc");
        server.verify();
    }

    @Test
    void subscriptionLinkCarriesIntervalAndDescription() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/subscriptions"))
                .andExpect(jsonPath("$.interval").value("year"))
                .andExpect(jsonPath("$.description").value("Gym"))
                .andExpect(jsonPath("$.currency").value("CRC"))
                .andRespond(withSuccess("{\"id\":\"sub_9\",\"url\":\"https://pay.example/sub\"}",
                        MediaType.APPLICATION_JSON));

        PaymentLinkResult result = provider.createSubscriptionLink(request()
                .currency(CurrencyCode.CRC)
                .paymentType(PaymentType.RECURRING)
                .interval(BillingInterval.YEAR)
                .description("Gym")
                .build());

        assertThat(result.getUrl()).isEqualTo("https://pay.example/sub");
        server.verify();
    }

    @Test
    void responseWithoutUrlIsProviderApiError() {
        server.expect(requestTo(BASE_URL + "/payment_intents"))
                .andRespond(withSuccess("{\"id\":\"pi_1\"}", MediaType.APPLICATION_JSON));

        PaymentLinkException ex = catchThrowableOfType(
                () -> provider.createOneTimePaymentLink(request().build()), PaymentLinkException.class);

        assertThat(ex.getKind()).isEqualTo(ErrorKind.PROVIDER_API);
        assertThat(ex.getMessage()).contains("missing url");
    }

    @Test
    void missingCredentialMakesNoCall() {
        credentials.setSecretKey(null);

        PaymentLinkException ex = catchThrowableOfType(
                () -> provider.createOneTimePaymentLink(request().build()), PaymentLinkException.class);

        assertThat(ex.getKind()).isEqualTo(ErrorKind.PROVIDER_CONFIG);
        server.verify();
    }
}

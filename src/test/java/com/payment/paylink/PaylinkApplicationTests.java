package com.payment.paylink;

import com.payment.paylink.config.ProviderConfigReport;
import com.payment.paylink.core.PaymentLinkOrchestrator;
import com.payment.paylink.domain.ProviderId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PaylinkApplicationTests {

    @Autowired
    private PaymentLinkOrchestrator orchestrator;

    @Autowired
    private ProviderConfigReport configReport;

    @Test
    void contextLoadsWithBothProviders() {
        assertThat(orchestrator.getProvider(ProviderId.TILOPAY)).isPresent();
        assertThat(orchestrator.getProvider(ProviderId.ONVO)).isPresent();
        assertThat(configReport.validate(ProviderId.ONVO)).isEmpty();
    }
}

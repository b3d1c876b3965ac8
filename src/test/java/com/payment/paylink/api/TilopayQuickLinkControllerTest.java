package com.payment.paylink.api;

import com.payment.paylink.core.PaymentLinkOrchestrator;
import com.payment.paylink.core.PaymentLinkRequestValidator;
import com.payment.paylink.domain.ClassifiedError;
import com.payment.paylink.domain.ErrorKind;
import com.payment.paylink.domain.PaymentLinkOutcome;
import com.payment.paylink.domain.PaymentLinkResult;
import com.payment.paylink.domain.RawPaymentLinkRequest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = TilopayQuickLinkController.class)
@Import(PaymentLinkRequestValidator.class)
class TilopayQuickLinkControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentLinkOrchestrator orchestrator;

    @Test
    void recurringLinkBillsMonthlyAndReturnsToThisService() throws Exception {
        when(orchestrator.generate(eq("tilopay"), any()))
                .thenReturn(PaymentLinkOutcome.success(new PaymentLinkResult("https://pay.example/sub")));

        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "amount": 2100.89, "currency": "CRC", "description": "Plan", "isRecurring": true }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.url").value("https://pay.example/sub"));

        ArgumentCaptor<RawPaymentLinkRequest> captor = ArgumentCaptor.forClass(RawPaymentLinkRequest.class);
        verify(orchestrator).generate(eq("tilopay"), captor.capture());
        RawPaymentLinkRequest raw = captor.getValue();
        assertThat(raw.getPaymentType()).isEqualTo("recurring");
        assertThat(raw.getInterval()).isEqualTo("month");
        assertThat(raw.getSuccessUrl()).isEqualTo("http://localhost:3000/success?provider=tilopay");
        assertThat(raw.getCancelUrl()).isEqualTo("http://localhost:3000/cancel?provider=tilopay");
    }

    @Test
    void oneTimeLinkHasNoInterval() throws Exception {
        when(orchestrator.generate(eq("tilopay"), any()))
                .thenReturn(PaymentLinkOutcome.success(new PaymentLinkResult("https://pay.example/once")));

        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"amount\": 10, \"currency\": \"USD\", \"isRecurring\": false }"))
                .andExpect(status().isOk());

        ArgumentCaptor<RawPaymentLinkRequest> captor = ArgumentCaptor.forClass(RawPaymentLinkRequest.class);
        verify(orchestrator).generate(eq("tilopay"), captor.capture());
        assertThat(captor.getValue().getPaymentType()).isEqualTo("one_time");
        assertThat(captor.getValue().getInterval()).isNull();
    }

    @Test
    void nonBooleanRecurringFlagIsRejected() throws Exception {
        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"amount\": 10, \"currency\": \"USD\", \"isRecurring\": \"yes\" }"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("isRecurring must be a boolean"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void upstreamFailureIs502() throws Exception {
        when(orchestrator.generate(eq("tilopay"), any())).thenReturn(PaymentLinkOutcome.failure(ClassifiedError.builder()
                .kind(ErrorKind.PROVIDER_API)
                .message("TiloPay API error (401): invalid key")
                .httpStatus(401)
                .build()));

        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"amount\": 10, \"currency\": \"USD\", \"isRecurring\": false }"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("TiloPay API error (401): invalid key"));
    }

    @Test
    void malformedJsonKeepsTheQuickLinkShape() throws Exception {
        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid JSON body"))
                .andExpect(jsonPath("$.kind").doesNotExist());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void amountAndCurrencyAreCheckedBeforeRecurringFlag() throws Exception {
        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"amount\": -5, \"currency\": \"USD\", \"isRecurring\": \"yes\" }"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("amount must be a positive number"));

        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"amount\": 5, \"currency\": \"EUR\" }"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("currency must be \"USD\" or \"CRC\""));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void nonStringDescriptionIsRejected() throws Exception {
        mockMvc.perform(post("/api/tilopay/create-link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"amount\": 10, \"currency\": \"USD\", \"description\": 123, \"isRecurring\": false }"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("description must be a string"));

        verifyNoInteractions(orchestrator);
    }
}

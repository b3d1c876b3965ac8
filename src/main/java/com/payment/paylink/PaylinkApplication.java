package com.payment.paylink;

import com.payment.paylink.config.PaylinkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the PayLink checkout service. Exposes:
 * <ul>
 *   <li>Hosted checkout links over TiloPay (single call) and ONVO (dependent resources)</li>
 *   <li>One-time payments and monthly/yearly subscriptions in USD or CRC</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(PaylinkProperties.class)
public class PaylinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaylinkApplication.class, args);
    }
}

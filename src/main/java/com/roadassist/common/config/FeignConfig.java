package com.roadassist.common.config;

import feign.Request;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Feign client setup for the external place search provider.
 *
 * <p>Timeouts are kept short (3s connect, 5s read) so a slow provider trips the Resilience4j
 * retry and circuit breaker on {@code PlaceSearchGateway} instead of holding search threads.</p>
 */
@Configuration
@EnableFeignClients(basePackages = "com.roadassist.geo.client")
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,
                5, TimeUnit.SECONDS,
                true
        );
    }
}

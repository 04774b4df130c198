package com.events.catalog.config;

import com.events.catalog.service.registration.SlotContendedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Slf4j
@Configuration
public class RegistrationRetryConfig {

    // 슬롯 경합만 재시도한다. 정원 마감/중복 등록은 즉시 실패
    @Bean
    public RetryTemplate registrationRetryTemplate(
            @Value("${registration.max-attempts:5}") int maxAttempts,
            @Value("${registration.backoff.initial-ms:20}") long initialMs,
            @Value("${registration.backoff.multiplier:2.0}") double multiplier,
            @Value("${registration.backoff.max-ms:200}") long maxMs) {
        log.info("등록 재시도 설정: maxAttempts={}, backoff={}ms x{} (max {}ms, jitter)",
                maxAttempts, initialMs, multiplier, maxMs);
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialMs, multiplier, maxMs, true)
                .retryOn(SlotContendedException.class)
                .build();
    }
}

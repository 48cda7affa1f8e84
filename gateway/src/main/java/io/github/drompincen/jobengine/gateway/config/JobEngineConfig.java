package io.github.drompincen.jobengine.gateway.config;

import io.github.drompincen.jobengine.runtime.dispatch.DispatchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class JobEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(JobEngineConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    DispatchPolicy dispatchPolicy(
            @Value("${jobengine.dispatcher.batch-size:50}") int batchSize,
            @Value("${jobengine.dispatcher.worker-threads:4}") int workerThreads,
            @Value("${jobengine.dispatcher.handler-timeout-ms:30000}") long handlerTimeoutMs,
            @Value("${jobengine.dispatcher.max-attempts:3}") int maxAttempts,
            @Value("${jobengine.dispatcher.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${jobengine.dispatcher.backoff-multiplier:2.0}") double backoffMultiplier,
            @Value("${jobengine.dispatcher.max-backoff-ms:30000}") long maxBackoffMs,
            @Value("${jobengine.dispatcher.catch-up-window-ms:86400000}") long catchUpWindowMs,
            @Value("${jobengine.dispatcher.pause-after-consecutive-failures:0}") int pauseAfter,
            @Value("${jobengine.dispatcher.lease-ms:300000}") long leaseMs) {
        DispatchPolicy policy = new DispatchPolicy(batchSize, workerThreads, Duration.ofMillis(handlerTimeoutMs),
                maxAttempts, Duration.ofMillis(initialBackoffMs), backoffMultiplier, Duration.ofMillis(maxBackoffMs),
                Duration.ofMillis(catchUpWindowMs), pauseAfter);

        if (!leaseCovers(policy, leaseMs)) {
            log.warn("Claim lease {} ms does not cover one handler attempt plus backoff ({} ms); "
                    + "a slow job may be claimed twice", leaseMs, policy.longestLeaseGap().toMillis());
        }
        return policy;
    }

    /** The lease is renewed before each attempt, so it only has to span the gap between renewals. */
    static boolean leaseCovers(DispatchPolicy policy, long leaseMs) {
        return leaseMs > policy.longestLeaseGap().toMillis();
    }
}

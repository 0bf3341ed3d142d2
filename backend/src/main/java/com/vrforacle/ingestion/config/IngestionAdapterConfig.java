package com.vrforacle.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vrforacle.common.RetryPolicy;
import com.vrforacle.config.VrfOracleContext;
import com.vrforacle.ingestion.adapter.solana.SolanaLedgerClient;
import com.vrforacle.ingestion.adapter.solana.SolanaPubSubClient;
import com.vrforacle.ingestion.adapter.solana.SolanaRpcClient;
import com.vrforacle.ingestion.adapter.solana.WebClientSolanaRpcClient;
import com.vrforacle.ingestion.adapter.solana.WebSocketSolanaPubSubClient;
import com.vrforacle.ingestion.submit.SubmissionErrorClassifier;
import com.vrforacle.ingestion.submit.TransactionSubmitter;
import com.vrforacle.vrf.EcVrf;
import com.vrforacle.vrf.VrfEngine;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.time.Duration;

/**
 * Wires the ledger clients, VRF engine and submission driver from the vrf-oracle.* properties.
 * Key material and cluster are validated here, so a bad configuration stops startup.
 */
@Configuration
@EnableConfigurationProperties({ OracleProperties.class, RpcProperties.class, SubmissionProperties.class, SubscriptionProperties.class, BackfillProperties.class, FulfillmentProperties.class })
public class IngestionAdapterConfig {

    public static final String SOLANA_RPC_RATE_LIMITER = "solanaRpcRateLimiter";
    public static final String SUBMISSION_RETRY_POLICY = "submissionRetryPolicy";
    public static final String RECONNECT_RETRY_POLICY = "reconnectRetryPolicy";

    @Bean
    public VrfOracleContext vrfOracleContext(OracleProperties properties) {
        return VrfOracleContext.from(properties);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, RpcProperties rpcProperties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(Math.max(1L, rpcProperties.getTimeoutMs())));
    }

    @Bean(name = SOLANA_RPC_RATE_LIMITER)
    public RateLimiter solanaRpcRateLimiter(RpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public SolanaLedgerClient solanaLedgerClient(SolanaRpcClient rpcClient,
                                                 @Qualifier(SOLANA_RPC_RATE_LIMITER) RateLimiter rateLimiter,
                                                 VrfOracleContext context,
                                                 ObjectMapper objectMapper) {
        return new SolanaLedgerClient(rpcClient, context.cluster().url(), rateLimiter, objectMapper);
    }

    @Bean
    public SolanaPubSubClient solanaPubSubClient(VrfOracleContext context, ObjectMapper objectMapper) {
        return new WebSocketSolanaPubSubClient(new ReactorNettyWebSocketClient(), context.cluster().wsUrl(), objectMapper);
    }

    @Bean
    public EcVrf ecVrf() {
        return new EcVrf();
    }

    @Bean
    public VrfEngine vrfEngine(EcVrf ecVrf, OracleProperties properties) {
        return new VrfEngine(ecVrf, VrfOracleContext.toBytes("vrf-private-key", properties.getVrfPrivateKey()));
    }

    @Bean(name = SUBMISSION_RETRY_POLICY)
    public RetryPolicy submissionRetryPolicy(SubmissionProperties properties) {
        return new RetryPolicy(
                properties.getBaseDelayMs(),
                properties.getJitterFactor(),
                properties.getMaxAttempts(),
                properties.getMaxDelayMs());
    }

    /** Reconnects never give up; only the delay is taken from this policy. */
    @Bean(name = RECONNECT_RETRY_POLICY)
    public RetryPolicy reconnectRetryPolicy(SubscriptionProperties properties) {
        return new RetryPolicy(
                properties.getReconnectBaseDelayMs(),
                properties.getJitterFactor(),
                Integer.MAX_VALUE,
                properties.getReconnectMaxDelayMs());
    }

    @Bean
    public TransactionSubmitter transactionSubmitter(SolanaLedgerClient ledgerClient,
                                                     VrfOracleContext context,
                                                     SubmissionErrorClassifier classifier,
                                                     @Qualifier(SUBMISSION_RETRY_POLICY) RetryPolicy retryPolicy,
                                                     SubmissionProperties properties) {
        return new TransactionSubmitter(ledgerClient, context.signer(), context.commitment(), classifier, retryPolicy,
                new TransactionSubmitter.SubmissionSettings(
                        properties.isSkipPreflight(),
                        properties.getConfirmationPollIntervalMs(),
                        properties.getConfirmationTimeoutMs()));
    }
}

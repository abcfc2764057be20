package com.example.callbackscheduler.service.transport;

import com.example.callbackscheduler.config.CallbackSchedulerProperties;
import com.example.callbackscheduler.config.MetricsConfig;
import com.example.callbackscheduler.domain.enums.CallbackMethod;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Delivers callbacks over HTTP with bounded retries.
 * <p>
 * Uses:
 * - WebClient for the request, blocking on the worker thread
 * - Resilience4j Retry with jittered exponential backoff between attempts
 */
@Slf4j
@Component
public class CallbackClient {

    private final WebClient webClient;
    private final MetricsConfig metricsConfig;
    private final Duration attemptTimeout;

    public CallbackClient(@Qualifier("callbackWebClient") WebClient webClient, MetricsConfig metricsConfig,
                          CallbackSchedulerProperties properties) {
        this.webClient = webClient;
        this.metricsConfig = metricsConfig;
        this.attemptTimeout = Duration.ofMillis((long) properties.getConnectTimeoutMs() + properties.getClientTimeoutMs());
    }

    /**
     * Send a callback, retrying transport failures, 5xx and other unexpected
     * statuses until {@code maxAttempts} is reached.
     * <p>
     * Returns as soon as the expected status or any 4xx arrives. When attempts
     * run out, the result carries the last 5xx seen (or 0) and the body of the
     * last attempt, which is the error message if that attempt failed in transport.
     *
     * @param maxAttempts total attempts; values below 1 mean a single attempt
     */
    public CallbackResponse sendWithRetry(String url, String payload, Map<String, String> headers,
                                          CallbackMethod method, int expectedStatus, int maxAttempts) {
        var attempts = Math.max(1, maxAttempts);
        var tracker = new ServerErrorTracker();

        var config = RetryConfig.<CallbackResponse>custom()
                .maxAttempts(attempts)
                .intervalBiFunction((attempt, outcome) -> waitBefore(attempt, tracker.last))
                .retryOnResult(response -> !isFinal(response, expectedStatus))
                .build();

        var retry = Retry.of("callback", config);
        retry.getEventPublisher().onRetry(event -> {
            log.debug("Retrying callback {} {} (attempt {}), waiting {}", method, url,
                    event.getNumberOfRetryAttempts(), event.getWaitInterval());
            metricsConfig.recordRetry();
        });

        var last = retry.executeSupplier(() -> tracker.track(attempt(url, payload, headers, method)));

        if (isFinal(last, expectedStatus)) {
            return last;
        }
        log.debug("Callback {} {} gave up after {} attempts, last status {}", method, url, attempts, last.getStatus());
        return CallbackResponse.of(tracker.lastServerError, last.getBody());
    }

    private CallbackResponse attempt(String url, String payload, Map<String, String> headers, CallbackMethod method) {
        try {
            var request = webClient.method(method.toHttpMethod())
                    .uri(URI.create(url))
                    .headers(h -> headers.forEach(h::set));

            if (method == CallbackMethod.POST) {
                request = request.header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE);
            }

            WebClient.RequestHeadersSpec<?> exchange = payload != null && !payload.isEmpty() ? request.bodyValue(payload) : request;

            var response = exchange.exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> CallbackResponse.of(clientResponse.statusCode().value(), body)))
                    .block(attemptTimeout);

            return response != null ? response : CallbackResponse.transportError("empty response");
        } catch (Exception e) {
            log.debug("Callback {} {} failed in transport: {}", method, url, e.getMessage());
            return CallbackResponse.transportError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Wait before the retry following attempt {@code attempt} (1-based).
     * Only transport failures and 5xx back off; other unexpected statuses retry at once.
     */
    static long waitBefore(int attempt, CallbackResponse previous) {
        if (previous != null && !previous.isTransportError() && !previous.isServerError()) {
            return 0L;
        }
        return Backoff.delayMillis(attempt - 1);
    }

    private static boolean isFinal(CallbackResponse response, int expectedStatus) {
        if (response.isTransportError()) {
            return false;
        }
        return response.getStatus() == expectedStatus || response.isClientError();
    }

    /**
     * Remembers the last response and the last 5xx across the attempts of one delivery
     */
    private static final class ServerErrorTracker {

        private int lastServerError = CallbackResponse.NO_STATUS;
        private CallbackResponse last;

        CallbackResponse track(CallbackResponse response) {
            last = response;
            if (response.isServerError()) {
                lastServerError = response.getStatus();
            }
            return response;
        }
    }
}

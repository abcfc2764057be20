package com.example.callbackscheduler.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient used to deliver callbacks.
 * <p>
 * Callback endpoints are absolute URLs supplied per task, so the client has no
 * base URL and no default content type.
 */
@Slf4j
@Configuration
public class WebClientConfig {

    public static final String SERVICE_NAME = "callback-scheduler";

    @Bean(name = "callbackWebClient")
    public WebClient callbackWebClient(WebClient.Builder builder, CallbackSchedulerProperties properties) {
        var clientTimeoutMs = properties.getClientTimeoutMs();

        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(clientTimeoutMs))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(clientTimeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(clientTimeoutMs, TimeUnit.MILLISECONDS)));

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("X-Service-Name", SERVICE_NAME)
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[callback] Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.debug("[callback] Error response: {}", clientResponse.statusCode());
            } else {
                log.debug("[callback] Response status: {}", clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}

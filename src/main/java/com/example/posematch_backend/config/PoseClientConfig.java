package com.example.posematch_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient for the pose sidecar. Responses are small JSON documents (33 landmarks per frame),
 * uploads are single PNG frames.
 */
@Configuration
@EnableConfigurationProperties(PoseProperties.class)
public class PoseClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(PoseClientConfig.class);

    static final int MAX_RESPONSE_BYTES = 512 * 1024;

    @Bean("poseWebClient")
    public WebClient poseWebClient(PoseProperties props) {
        LOGGER.info("Pose sidecar client: baseUrl={}, timeout={}s, connectTimeout={}s",
                props.getBaseUrl(), props.getTimeoutSeconds(), props.getConnectTimeoutSeconds());
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(sidecarHttpClient(props)))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                        .build())
                .filter(logNonSuccess())
                .build();
    }

    static HttpClient sidecarHttpClient(PoseProperties props) {
        int ioSeconds = (int) Math.max(1, props.getTimeoutSeconds());
        int connectMillis = Math.max(1, props.getConnectTimeoutSeconds()) * 1000;
        return HttpClient.create()
                .responseTimeout(Duration.ofSeconds(ioSeconds))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMillis)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(ioSeconds))
                        .addHandlerLast(new WriteTimeoutHandler(ioSeconds)));
    }

    private static ExchangeFilterFunction logNonSuccess() {
        return (request, next) -> next.exchange(request).doOnNext(response -> {
            if (response.statusCode().isError()) {
                LOGGER.debug("pose sidecar {} {} -> {}", request.method(), request.url().getPath(), response.statusCode());
            }
        });
    }
}

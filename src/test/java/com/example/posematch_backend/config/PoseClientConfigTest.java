package com.example.posematch_backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class PoseClientConfigTest {

    @Test
    void clientTargetsConfiguredSidecarAndAcceptsJson() {
        PoseProperties props = new PoseProperties();
        props.setBaseUrl("http://pose.internal:9000");
        List<ClientRequest> seen = new CopyOnWriteArrayList<>();

        WebClient client = new PoseClientConfig().poseWebClient(props).mutate()
                .exchangeFunction(request -> {
                    seen.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("{\"sessionId\":\"s-9\"}")
                            .build());
                })
                .build();

        String body = client.post().uri("/v1/pose/sessions").retrieve().bodyToMono(String.class).block();

        assertThat(body).contains("s-9");
        assertThat(seen).singleElement().satisfies(request -> {
            assertThat(request.url().toString()).isEqualTo("http://pose.internal:9000/v1/pose/sessions");
            assertThat(request.headers().getAccept()).containsExactly(MediaType.APPLICATION_JSON);
        });
    }

    @Test
    void errorResponsesPassThroughTheLoggingFilter() {
        PoseProperties props = new PoseProperties();
        WebClient client = new PoseClientConfig().poseWebClient(props).mutate()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build()))
                .build();

        HttpStatus status = client.delete().uri("/v1/pose/sessions/{id}", "s-1")
                .exchangeToMono(response -> Mono.just(HttpStatus.valueOf(response.statusCode().value())))
                .block();

        assertThat(status).isEqualTo(HttpStatus.BAD_GATEWAY);
    }
}

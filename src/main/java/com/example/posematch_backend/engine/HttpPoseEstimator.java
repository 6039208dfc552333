package com.example.posematch_backend.engine;

import com.example.posematch_backend.config.PoseProperties;
import com.example.posematch_backend.dto.LandmarkPoint;
import com.example.posematch_backend.dto.LandmarkSet;
import com.example.posematch_backend.dto.PoseDetectResponse;
import com.example.posematch_backend.dto.PoseSessionResponse;
import com.example.posematch_backend.engine.Interfaces.PoseEstimator;
import com.example.posematch_backend.exception.PoseEstimationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pose estimation backed by a MediaPipe sidecar over HTTP. Each session maps to one model instance on the
 * sidecar, which is freed by {@code DELETE /v1/pose/sessions/{id}}.
 */
@Component
public class HttpPoseEstimator implements PoseEstimator {
    private static final Logger log = LoggerFactory.getLogger(HttpPoseEstimator.class);

    private final WebClient client;
    private final PoseProperties props;
    private final Duration timeout;

    public HttpPoseEstimator(@Qualifier("poseWebClient") WebClient client, PoseProperties props) {
        this.client = client;
        this.props = props;
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }

    @Override
    public PoseSession openSession() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("modelComplexity", props.getModelComplexity());
        body.put("minDetectionConfidence", props.getMinDetectionConfidence());

        PoseSessionResponse response;
        try {
            response = client.post()
                    .uri("/v1/pose/sessions")
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(b -> new PoseEstimationException("Pose sidecar error " + resp.statusCode() + ": " + b)))
                    .bodyToMono(PoseSessionResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (PoseEstimationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PoseEstimationException("Pose session could not be opened: " + e.getMessage(), e);
        }
        if (response == null || response.sessionId() == null || response.sessionId().isBlank()) {
            throw new PoseEstimationException("Pose sidecar returned no session id");
        }
        log.debug("pose session {} opened", response.sessionId());
        return new HttpPoseSession(response.sessionId());
    }

    private final class HttpPoseSession implements PoseSession {
        private final String sessionId;
        private boolean closed;

        private HttpPoseSession(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public LandmarkSet estimate(Path frame) {
            if (closed) {
                throw new IllegalStateException("pose session " + sessionId + " is closed");
            }
            BufferedImage image;
            try {
                image = ImageIO.read(frame.toFile());
            } catch (IOException e) {
                log.warn("Failed to load frame {}: {}", frame, e.toString());
                return LandmarkSet.ABSENT;
            }
            if (image == null) {
                log.warn("Frame {} is not a decodable image", frame);
                return LandmarkSet.ABSENT;
            }

            var mb = new LinkedMultiValueMap<String, Object>();
            mb.add("image", new FileSystemResource(frame));
            mb.add("width", String.valueOf(image.getWidth()));
            mb.add("height", String.valueOf(image.getHeight()));

            long start = System.currentTimeMillis();
            PoseDetectResponse response;
            try {
                response = client.post()
                        .uri("/v1/pose/sessions/{id}/detect", sessionId)
                        .body(BodyInserters.fromMultipartData(mb))
                        .retrieve()
                        .onStatus(HttpStatusCode::isError, resp ->
                                resp.bodyToMono(String.class)
                                        .defaultIfEmpty("")
                                        .map(b -> new PoseEstimationException("Pose sidecar error " + resp.statusCode() + ": " + b)))
                        .bodyToMono(PoseDetectResponse.class)
                        .timeout(timeout)
                        .block();
            } catch (PoseEstimationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PoseEstimationException("Pose estimation failed for " + frame.getFileName() + ": " + e.getMessage(), e);
            }
            log.debug("pose {} processed in {} ms", frame.getFileName(), System.currentTimeMillis() - start);
            return toLandmarkSet(response);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                client.delete()
                        .uri("/v1/pose/sessions/{id}", sessionId)
                        .retrieve()
                        .toBodilessEntity()
                        .timeout(timeout)
                        .block();
                log.debug("pose session {} released", sessionId);
            } catch (RuntimeException e) {
                // the sidecar expires idle sessions on its own
                log.warn("Failed to release pose session {}: {}", sessionId, e.toString());
            }
        }
    }

    static LandmarkSet toLandmarkSet(PoseDetectResponse response) {
        if (response == null || !response.detected() || response.landmarks() == null || response.landmarks().isEmpty()) {
            return LandmarkSet.ABSENT;
        }
        // null entries leave the set short of 33 points, which scores as malformed
        List<LandmarkPoint> points = response.landmarks().stream()
                .filter(Objects::nonNull)
                .map(l -> new LandmarkPoint(l.x(), l.y(), l.z(), l.visibility()))
                .toList();
        return LandmarkSet.of(points);
    }
}

package com.example.posematch_backend.controller;

import com.example.posematch_backend.config.AnalysisProperties;
import com.example.posematch_backend.dto.AnalysisRequest;
import com.example.posematch_backend.dto.SimilarityResult;
import com.example.posematch_backend.dto.web.AnalysisResponse;
import com.example.posematch_backend.service.AnalysisCoordinator;
import com.example.posematch_backend.service.AnalysisRun;
import com.example.posematch_backend.service.UploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1/analyses")
public class AnalysisController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisCoordinator coordinator;
    private final UploadService uploadService;
    private final AnalysisProperties properties;

    public AnalysisController(AnalysisCoordinator coordinator, UploadService uploadService, AnalysisProperties properties) {
        this.coordinator = coordinator;
        this.uploadService = uploadService;
        this.properties = properties;
    }

    @Operation(summary = "Compare the movement in a short clip against a reference clip")
    @ApiResponse(responseCode = "200", description = "Both clips were analysed and scored")
    @ApiResponse(responseCode = "400", description = "Missing upload, unreadable video or short clip too long")
    @ApiResponse(responseCode = "502", description = "ffmpeg, ffprobe or the pose engine failed")
    @ApiResponse(responseCode = "503", description = "Run cancelled or timed out")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalysisResponse analyze(
            @RequestPart(value = "short_video", required = false) MultipartFile shortVideo,
            @RequestPart(value = "reference_video", required = false) MultipartFile referenceVideo,
            @RequestParam(value = "targetFrames", required = false) String targetFrames) {
        Integer requested = parseOrNull(targetFrames);
        int frames = properties.resolveTargetFrames(requested);
        if (requested == null || requested != frames) {
            LOGGER.info("targetFrames={} missing or outside [{}, {}], using {}",
                    targetFrames, properties.getMinTargetFrames(), properties.getMaxTargetFrames(), frames);
        }

        UploadService.StoredPair stored = uploadService.storePair(shortVideo, referenceVideo);
        AnalysisRequest request = new AnalysisRequest(stored.shortVideo(), stored.referenceVideo(), frames,
                properties.getMaxShortDurationSeconds(), true);

        AnalysisRun run = coordinator.analyze(request);
        if (run.getFailure() != null) {
            throw run.getFailure();
        }
        SimilarityResult result = run.getResult();
        return new AnalysisResponse(run.getRunId(), frames, result.score(), result.analysisText(),
                result.averageDissimilarity(), result.mismatchedFrames());
    }

    private static Integer parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

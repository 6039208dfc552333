package com.example.posematch_backend.config;

import com.example.posematch_backend.engine.FfmpegFrameSampler;
import com.example.posematch_backend.engine.FfprobeMetadataProbe;
import com.example.posematch_backend.engine.Interfaces.FrameSampler;
import com.example.posematch_backend.engine.Interfaces.MetadataProbe;
import com.example.posematch_backend.engine.ProcessRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineConfig {

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    public MetadataProbe metadataProbe(
            ProcessRunner processRunner,
            ObjectMapper objectMapper,
            @Value("${ffprobe.binary:ffprobe}") String ffprobeBin,
            @Value("${engine.probe.timeoutSeconds:30}") long timeoutSeconds
    ) {
        return new FfprobeMetadataProbe(processRunner, objectMapper, ffprobeBin, Duration.ofSeconds(Math.max(1, timeoutSeconds)));
    }

    @Bean
    public FrameSampler frameSampler(
            ProcessRunner processRunner,
            @Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
            @Value("${engine.extract.timeoutSeconds:120}") long timeoutSeconds
    ) {
        return new FfmpegFrameSampler(processRunner, ffmpegBin, Duration.ofSeconds(Math.max(1, timeoutSeconds)));
    }
}

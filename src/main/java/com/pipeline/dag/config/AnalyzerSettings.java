package com.pipeline.dag.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Thresholds used by the analysis passes.
 *
 * <p>
 * Defaults match the heuristics the analyzer has always used. A JSON file may
 * override any subset:
 *
 * <pre>{@code
 * { "bottleneckOutDegree": 4, "longChainThreshold": 6 }
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnalyzerSettings {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Weight in seconds for a job whose estimate is absent or zero. */
    private int defaultJobDuration = 60;

    /** A job blocking at least this many dependents is a bottleneck. */
    private int bottleneckOutDegree = 3;

    /** A hop-count chain longer than this many jobs is reported. */
    private int longChainThreshold = 4;

    /** A bottleneck with more steps than this gets a split suggestion. */
    private int splitBottleneckMinSteps = 5;

    /** Any job with more steps than this gets a large-job suggestion. */
    private int largeJobMinSteps = 10;

    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings();
    }

    public static AnalyzerSettings fromJson(String json) {
        try {
            return MAPPER.readValue(json, AnalyzerSettings.class).validate();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid analyzer settings: " + e.getOriginalMessage(), e);
        }
    }

    public static AnalyzerSettings load(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read analyzer settings from " + path, e);
        }
    }

    /** Rejects non-positive thresholds. Returns {@code this} for chaining. */
    public AnalyzerSettings validate() {
        requirePositive("defaultJobDuration", defaultJobDuration);
        requirePositive("bottleneckOutDegree", bottleneckOutDegree);
        requirePositive("longChainThreshold", longChainThreshold);
        requirePositive("splitBottleneckMinSteps", splitBottleneckMinSteps);
        requirePositive("largeJobMinSteps", largeJobMinSteps);
        return this;
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0)
            throw new IllegalArgumentException(key + " must be positive, got " + value);
    }
}

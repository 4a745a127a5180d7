package com.pipeline.dag.config;

import com.pipeline.dag.PipelineDag;

import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Paths;

import org.junit.Test;

import static org.junit.Assert.*;

public class AnalyzerSettingsTest {

    @Test
    public void testDefaults() {
        AnalyzerSettings s = AnalyzerSettings.defaults();
        assertEquals(60, s.getDefaultJobDuration());
        assertEquals(3, s.getBottleneckOutDegree());
        assertEquals(4, s.getLongChainThreshold());
        assertEquals(5, s.getSplitBottleneckMinSteps());
        assertEquals(10, s.getLargeJobMinSteps());
    }

    @Test
    public void testPartialOverride() {
        AnalyzerSettings s = AnalyzerSettings.fromJson("{\"bottleneckOutDegree\": 4, \"longChainThreshold\": 6}");
        assertEquals(4, s.getBottleneckOutDegree());
        assertEquals(6, s.getLongChainThreshold());
        assertEquals(60, s.getDefaultJobDuration());
    }

    @Test
    public void testLoadFromFile() throws URISyntaxException {
        AnalyzerSettings s = AnalyzerSettings.load(
                Paths.get(AnalyzerSettingsTest.class.getResource("/settings/strict.json").toURI()));
        assertEquals(45, s.getDefaultJobDuration());
        assertEquals(2, s.getBottleneckOutDegree());
        assertEquals(3, s.getLongChainThreshold());
        assertEquals(10, s.getLargeJobMinSteps());
    }

    @Test(expected = UncheckedIOException.class)
    public void testLoadMissingFile() {
        AnalyzerSettings.load(Paths.get("no-such-settings.json"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositive() {
        AnalyzerSettings.fromJson("{\"defaultJobDuration\": 0}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsMalformed() {
        AnalyzerSettings.fromJson("{\"defaultJobDuration\": ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsWrongType() {
        AnalyzerSettings.fromJson("{\"largeJobMinSteps\": \"many\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAnalyzerValidatesSettings() {
        AnalyzerSettings s = AnalyzerSettings.defaults();
        s.setBottleneckOutDegree(-1);
        PipelineDag.create(s);
    }
}

package com.tenacy.labpulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.labpulse.detection.AnomalyAggregator;
import com.tenacy.labpulse.detection.AnomalyDetector;
import com.tenacy.labpulse.detection.HealthScorer;
import com.tenacy.labpulse.detection.impl.ErrorBurstDetector;
import com.tenacy.labpulse.detection.impl.RapidMetricChangeDetector;
import com.tenacy.labpulse.detection.impl.TemperatureZScoreDetector;
import com.tenacy.labpulse.diagnosis.DiagnosisEngine;
import com.tenacy.labpulse.diagnosis.RuleCatalog;
import com.tenacy.labpulse.diagnosis.RuleCatalogLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class AnalysisConfig {

    @Value("${labpulse.detection.temperature.z-threshold:3.0}")
    private double zThreshold;

    @Value("${labpulse.detection.error-burst.window-minutes:10}")
    private long errorBurstWindowMinutes;

    @Value("${labpulse.detection.error-burst.threshold:5}")
    private int errorBurstThreshold;

    @Value("${labpulse.detection.rapid-change.metric:temperature}")
    private String rapidChangeMetric;

    @Value("${labpulse.detection.rapid-change.window-minutes:5}")
    private long rapidChangeWindowMinutes;

    @Value("${labpulse.detection.rapid-change.threshold-percent:30.0}")
    private double rapidChangeThresholdPercent;

    @Value("${labpulse.diagnosis.catalog-location:classpath:diagnosis-rules.json}")
    private String catalogLocation;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public TemperatureZScoreDetector temperatureZScoreDetector() {
        return new TemperatureZScoreDetector(zThreshold);
    }

    @Bean
    public ErrorBurstDetector errorBurstDetector() {
        return new ErrorBurstDetector(Duration.ofMinutes(errorBurstWindowMinutes), errorBurstThreshold);
    }

    @Bean
    public RapidMetricChangeDetector rapidMetricChangeDetector() {
        return new RapidMetricChangeDetector(rapidChangeMetric,
                Duration.ofMinutes(rapidChangeWindowMinutes), rapidChangeThresholdPercent);
    }

    @Bean
    public AnomalyAggregator anomalyAggregator(List<AnomalyDetector> detectors) {
        return new AnomalyAggregator(detectors);
    }

    @Bean
    public HealthScorer healthScorer() {
        return new HealthScorer();
    }

    @Bean
    public RuleCatalog ruleCatalog(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new RuleCatalogLoader(objectMapper).load(resourceLoader.getResource(catalogLocation));
    }

    @Bean
    public DiagnosisEngine diagnosisEngine(RuleCatalog ruleCatalog) {
        return new DiagnosisEngine(ruleCatalog);
    }
}

package com.commandertracker.stats.config;

import com.commandertracker.common.pressure.PressureLabelTable;
import com.commandertracker.common.report.StatsOptions;
import com.commandertracker.common.report.StatsReportAssembler;
import com.commandertracker.common.report.StatsReportSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StatsConfig {

    private static final Logger log = LoggerFactory.getLogger(StatsConfig.class);

    @Value("${stats.weighting.alpha:0.5}")
    private double alpha;

    @Value("${stats.limits.top-triples:50}")
    private int topTriples;

    @Value("${stats.limits.max-unique-triples:200}")
    private int maxUniqueTriples;

    @Value("${stats.limits.recent-games:30}")
    private int recentGames;

    @Value("${stats.pressure.bands:>-1.0:fair,1.0:over,2.0:pubstomp}")
    private String pressureBands;

    @Value("${stats.pressure.base-label:underdog}")
    private String pressureBaseLabel;

    /**
     * Sanitized options. Out-of-range numbers are clamped; unparseable pressure bands
     * throw {@link IllegalArgumentException} and abort the start.
     */
    @Bean
    public StatsOptions statsOptions() {
        PressureLabelTable labels = PressureLabelTable.parse(pressureBaseLabel, pressureBands);
        StatsOptions configured = new StatsOptions(alpha, topTriples, maxUniqueTriples, recentGames, labels);
        StatsOptions sanitized = configured.sanitized();
        if (!sanitized.equals(configured)) {
            log.warn("Stats options clamped. configured={} effective={}", configured, sanitized);
        }
        return sanitized;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StatsReportAssembler statsReportAssembler(Clock clock) {
        return new StatsReportAssembler(clock);
    }

    @Bean
    public StatsReportSerializer statsReportSerializer(ObjectMapper objectMapper) {
        return new StatsReportSerializer(objectMapper);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}

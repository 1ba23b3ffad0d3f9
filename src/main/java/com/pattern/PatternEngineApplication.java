package com.pattern;

import com.pattern.core.ChartContextFactory;
import com.pattern.core.PatternMatch;
import com.pattern.engine.PatternEvaluationCoordinator;
import com.pattern.spring.EnablePatternEngine;
import com.pattern.store.PatternStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ClassPathResource;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application: seeds a few patterns and evaluates them
 * against a bundled chart.
 */
@SpringBootApplication
@EnablePatternEngine
public class PatternEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(PatternEngineApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PatternEngineApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(PatternStore store, PatternEvaluationCoordinator coordinator) {
        return args -> {
            log.info("=== Pattern Engine Demo Started ===");

            if (store.list().isEmpty()) {
                seed(store);
            }

            Map<String, Object> chart;
            try (InputStream in = new ClassPathResource("sample-chart.json").getInputStream()) {
                chart = ChartContextFactory.fromJson(in);
            }

            List<PatternMatch> matches = coordinator.evaluateAll(chart);
            log.info("{} pattern(s) matched the sample chart", matches.size());
            for (PatternMatch match : matches) {
                log.info("  [{}] {}: {}", match.id(), match.name(), match.description());
            }

            log.info("=== Pattern Engine Demo Finished ===");
        };
    }

    private static void seed(PatternStore store) {
        log.info("Seeding sample patterns");
        store.create("Ziwei in Life Palace", """
                        var life = context.palaces.find(function (p) { return p.name === '命宫'; });
                        return life !== undefined && life.stars.includes('紫微');""",
                "Emperor star sits in the life palace", "1984-03-12 male");
        store.create("Male chart", "return context.gender === 'male';",
                "Chart belongs to a male native", null);
        store.create("Crowded palace", """
                        return context.palaces.some(function (p) { return p.stars.length >= 3; });""",
                "At least one palace holds three or more major stars", null);
        store.create("Truthy but not true", "return 1;",
                "Only a real boolean true counts as a match", null);
    }
}

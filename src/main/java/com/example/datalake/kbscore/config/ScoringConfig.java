package com.example.datalake.kbscore.config;

import com.example.datalake.kbscore.validation.PlaceholderDetector;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ScoringConfig {

    @Bean
    public Clock scoringClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PlaceholderDetector placeholderDetector(ScoringProperties properties) {
        PlaceholderDetector detector = new PlaceholderDetector(properties.getPlaceholderMarkers());
        log.info("Placeholder detector initialized with {} markers ({} configured)",
                detector.markers().size(), properties.getPlaceholderMarkers().size());
        return detector;
    }
}

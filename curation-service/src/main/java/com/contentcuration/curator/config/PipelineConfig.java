package com.contentcuration.curator.config;

import com.contentcuration.curator.service.rating.RatingExtractor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock curatorClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RatingExtractor ratingExtractor(CuratorProperties properties) {
        return new RatingExtractor(properties.getRating().getReasoningMaxChars());
    }
}

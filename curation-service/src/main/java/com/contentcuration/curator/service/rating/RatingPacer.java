package com.contentcuration.curator.service.rating;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Cooperative pause between rating calls to stay under the rating tool's throughput limit.
 */
@Component
@Slf4j
public class RatingPacer {

    /**
     * @return false when interrupted; the caller should stop issuing calls
     */
    public boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Rating pause interrupted; stopping batch");
            return false;
        }
    }
}

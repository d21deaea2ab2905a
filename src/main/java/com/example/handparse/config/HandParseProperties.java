package com.example.handparse.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * Spring Boot configuration properties for the hand history parser.
 *
 * Usage:
 * {@code java -jar hand-parse.jar --handparse.max-hands-per-batch=1000}
 */
@Component
@ConfigurationProperties(prefix = "handparse")
public class HandParseProperties {
    private String referenceZone = "America/New_York";
    private int maxHandsPerBatch = 500;

    /**
     * Returns the zone in which the room writes its canonical ({@code ET}) timestamps.
     * @return zone id text, e.g. {@code America/New_York}
     */
    public String getReferenceZone() {
        return referenceZone;
    }

    public void setReferenceZone(String referenceZone) {
        this.referenceZone = referenceZone;
    }

    /**
     * Returns the reference zone as a {@link ZoneId}.
     * @return parsed zone
     */
    public ZoneId referenceZoneId() {
        return ZoneId.of(referenceZone);
    }

    /**
     * Returns the largest number of hands a single batch request may contain.
     * @return batch limit
     */
    public int getMaxHandsPerBatch() {
        return maxHandsPerBatch;
    }

    public void setMaxHandsPerBatch(int maxHandsPerBatch) {
        this.maxHandsPerBatch = maxHandsPerBatch;
    }
}

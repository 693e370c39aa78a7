package com.github.salilvnair.advisorengine.config;

import com.github.salilvnair.advisorengine.validate.ExcessOptionPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "advisorengine.rag")
@Getter
@Setter
public class AdvisorEngineRagConfig {

    /**
     * Briefs below this confidence are always flagged for scholar review.
     */
    private double scholarReviewThreshold = 0.6d;
    private boolean useFewShots = false;
    private boolean refusalDetectionEnabled = true;
    private String canonicalIdPrefix = "BG";
    private ExcessOptionPolicy excessOptionPolicy = ExcessOptionPolicy.KEEP_ALL;
    private int minSources = 3;
    private double injectionPenalty = 0.03d;
    private double degradedConfidenceCap = 0.5d;
    /**
     * Passages embedded in the full prompt.
     */
    private int promptPassageLimit = 5;
    private int condensedPassageCount = 3;
}

package com.dealflow.dedup.decision;

import com.dealflow.dedup.api.DetectionConfig;
import com.dealflow.dedup.core.model.SuggestedAction;

/**
 * Maps the best match confidence to a suggested action.
 */
public class DecisionPolicy {

    private final double autoMergeThreshold;
    private final double highThreshold;
    private final double mediumThreshold;
    private final double lowThreshold;

    public DecisionPolicy(DetectionConfig config) {
        this.autoMergeThreshold = config.getAutoMergeThreshold();
        this.highThreshold = config.getHighConfidenceThreshold();
        this.mediumThreshold = config.getMediumConfidenceThreshold();
        this.lowThreshold = config.getLowConfidenceThreshold();
    }

    /**
     * {@code AUTO_MERGE} at or above the auto-merge threshold, {@code MANUAL_REVIEW}
     * at or above the high threshold, otherwise {@code NO_ACTION}.
     */
    public SuggestedAction decide(double maxConfidence) {
        if (maxConfidence >= autoMergeThreshold) {
            return SuggestedAction.AUTO_MERGE;
        }
        if (maxConfidence >= highThreshold) {
            return SuggestedAction.MANUAL_REVIEW;
        }
        return SuggestedAction.NO_ACTION;
    }

    public ConfidenceLevel classify(double confidence) {
        if (confidence >= highThreshold) {
            return ConfidenceLevel.HIGH;
        }
        if (confidence >= mediumThreshold) {
            return ConfidenceLevel.MEDIUM;
        }
        if (confidence >= lowThreshold) {
            return ConfidenceLevel.LOW;
        }
        return ConfidenceLevel.NONE;
    }
}

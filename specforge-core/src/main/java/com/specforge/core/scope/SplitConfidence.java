package com.specforge.core.scope;

/**
 * Confidence in a split recommendation, derived from the total scope score.
 *
 * <p><b>Levels:</b></p>
 * <ul>
 *   <li><b>VERY_HIGH:</b> score of 15 or more</li>
 *   <li><b>HIGH:</b> 12 or more</li>
 *   <li><b>MEDIUM:</b> 8 or more</li>
 *   <li><b>LOW:</b> 5 or more</li>
 *   <li><b>VERY_LOW:</b> below 5</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum SplitConfidence {
    VERY_LOW(0),
    LOW(5),
    MEDIUM(8),
    HIGH(12),
    VERY_HIGH(15);

    private final double minimumScore;

    SplitConfidence(double minimumScore) {
        this.minimumScore = minimumScore;
    }

    public double minimumScore() {
        return minimumScore;
    }

    /**
     * Maps a total score to a confidence level.
     *
     * @param score total scope score
     * @return highest level whose minimum the score reaches
     */
    public static SplitConfidence fromScore(double score) {
        SplitConfidence result = VERY_LOW;
        for (SplitConfidence level : values()) {
            if (score >= level.minimumScore) {
                result = level;
            }
        }
        return result;
    }
}

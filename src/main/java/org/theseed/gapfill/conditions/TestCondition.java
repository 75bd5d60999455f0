/**
 *
 */
package org.theseed.gapfill.conditions;

import org.theseed.gapfill.model.Media;
import org.theseed.gapfill.model.Objective;

/**
 * A test condition specifies a media, an objective, and a threshold the objective value must
 * respect.  For a maximum threshold, the condition fails if the objective reaches the threshold;
 * otherwise it fails if the objective does not exceed the threshold.  In change mode the objective
 * value is measured relative to the last passing objective.
 *
 * Conditions are immutable.
 */
public class TestCondition {

    // FIELDS
    /** media for the test */
    private Media media;
    /** objective to optimize */
    private Objective objective;
    /** TRUE if the threshold is a maximum */
    private boolean maxThreshold;
    /** threshold value */
    private double threshold;
    /** TRUE to test the change from the prior objective */
    private boolean change;

    /**
     * Construct a test condition.
     *
     * @param media				media for the test
     * @param objective			objective to optimize
     * @param maxThreshold		TRUE if the threshold is a maximum, FALSE if it is a minimum
     * @param threshold			threshold value
     * @param change			TRUE to compare the change from the prior objective
     */
    public TestCondition(Media media, Objective objective, boolean maxThreshold, double threshold, boolean change) {
        if (media == null || objective == null)
            throw new IllegalArgumentException("A test condition requires both a media and an objective.");
        this.media = media;
        this.objective = objective;
        this.maxThreshold = maxThreshold;
        this.threshold = threshold;
        this.change = change;
    }

    /**
     * Construct an absolute test condition.
     *
     * @param media				media for the test
     * @param objective			objective to optimize
     * @param maxThreshold		TRUE if the threshold is a maximum, FALSE if it is a minimum
     * @param threshold			threshold value
     */
    public TestCondition(Media media, Objective objective, boolean maxThreshold, double threshold) {
        this(media, objective, maxThreshold, threshold, false);
    }

    /**
     * @return a condition requiring the target reaction to exceed a minimum in the specified media
     *
     * @param media			media for the test
     * @param target		ID of the target reaction
     * @param threshold		minimum objective value
     */
    public static TestCondition growth(Media media, String target, double threshold) {
        return new TestCondition(media, Objective.of(target), false, threshold);
    }

    /**
     * @return the media
     */
    public Media getMedia() {
        return this.media;
    }

    /**
     * @return the objective
     */
    public Objective getObjective() {
        return this.objective;
    }

    /**
     * @return TRUE if the threshold is a maximum
     */
    public boolean isMaxThreshold() {
        return this.maxThreshold;
    }

    /**
     * @return the threshold
     */
    public double getThreshold() {
        return this.threshold;
    }

    /**
     * @return TRUE if this condition measures the change from the prior objective
     */
    public boolean isChange() {
        return this.change;
    }

    @Override
    public String toString() {
        return this.media.getId() + "/" + this.objective.getId() + (this.maxThreshold ? " < " : " > ")
                + this.threshold + (this.change ? " (change)" : "");
    }

}

/**
 *
 */
package org.theseed.gapfill.reduce;

import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;

/**
 * A candidate reaction is a reaction direction under test by the reaction set reducer.  It
 * remembers the bound it had before it was blocked, the test score recorded when it was
 * filtered, and the reliability score used to order the search.
 *
 * Two candidates are equal if they have the same reaction ID and direction.
 */
public class CandidateReaction implements Comparable<CandidateReaction> {

    // FIELDS
    /** ID of the reaction */
    private String reactionId;
    /** direction under test */
    private Direction direction;
    /** bound before the candidate was blocked, or NaN if it has not been blocked */
    private double originalBound;
    /** test score recorded when the candidate was filtered, or NaN */
    private double score;
    /** reliability score (lower is more suspect) */
    private double reliability;

    /**
     * Construct a candidate reaction.
     *
     * @param reactionId	ID of the reaction
     * @param direction		direction under test
     */
    public CandidateReaction(String reactionId, Direction direction) {
        if (reactionId == null || direction == null)
            throw new IllegalArgumentException("Candidate reactions require an ID and a direction.");
        this.reactionId = reactionId;
        this.direction = direction;
        this.originalBound = Double.NaN;
        this.score = Double.NaN;
        this.reliability = 0.0;
    }

    /**
     * Block this candidate in the model, remembering the original bound.
     *
     * @param model		model containing the reaction
     */
    public void zero(FluxModel model) {
        this.originalBound = model.zeroBound(this.reactionId, this.direction);
    }

    /**
     * Restore this candidate's original bound in the model.  If the candidate was never blocked,
     * nothing happens.
     *
     * @param model		model containing the reaction
     */
    public void restore(FluxModel model) {
        if (! Double.isNaN(this.originalBound))
            model.setBound(this.reactionId, this.direction, this.originalBound);
    }

    /**
     * Block this candidate again without changing the remembered original bound.
     *
     * @param model		model containing the reaction
     */
    public void reblock(FluxModel model) {
        model.setBound(this.reactionId, this.direction, 0.0);
    }

    /**
     * @return the reaction ID
     */
    public String getReactionId() {
        return this.reactionId;
    }

    /**
     * @return the direction under test
     */
    public Direction getDirection() {
        return this.direction;
    }

    /**
     * @return the bound before the candidate was blocked, or NaN if it was never blocked
     */
    public double getOriginalBound() {
        return this.originalBound;
    }

    /**
     * Specify the original bound.  This is used when the candidate is rebuilt from the filter cache.
     *
     * @param originalBound 	the original bound to set
     */
    public void setOriginalBound(double originalBound) {
        this.originalBound = originalBound;
    }

    /**
     * @return the test score recorded when the candidate was filtered
     */
    public double getScore() {
        return this.score;
    }

    /**
     * @param score 	the test score to record
     */
    public void setScore(double score) {
        this.score = score;
    }

    /**
     * @return the reliability score
     */
    public double getReliability() {
        return this.reliability;
    }

    /**
     * @param reliability 	the reliability score to set
     */
    public void setReliability(double reliability) {
        this.reliability = reliability;
    }

    @Override
    public int compareTo(CandidateReaction o) {
        int retVal = this.reactionId.compareTo(o.reactionId);
        if (retVal == 0)
            retVal = this.direction.compareTo(o.direction);
        return retVal;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.direction.hashCode();
        result = prime * result + this.reactionId.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof CandidateReaction))
            return false;
        CandidateReaction other = (CandidateReaction) obj;
        return this.direction == other.direction && this.reactionId.equals(other.reactionId);
    }

    @Override
    public String toString() {
        return this.direction.getSymbol() + this.reactionId;
    }

}

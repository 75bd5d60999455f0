/**
 *
 */
package org.theseed.gapfill;

import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.reduce.CandidateReaction;

/**
 * This object describes a single reaction direction in a gapfilling solution.  A reaction is either
 * new (copied into the model from the gapfilling database) or reversed (already in the model, but
 * opened in a new direction).
 *
 * Two gapfilled reactions are equal if they have the same reaction ID and direction.  The type
 * does not participate in equality.
 */
public class GapfilledReaction {

    // FIELDS
    /** ID of the reaction */
    private String reactionId;
    /** direction gapfilled */
    private Direction direction;
    /** type of gapfilling */
    private Type type;

    /**
     * This enumeration describes the types of gapfilling.
     */
    public static enum Type {
        /** reaction added to the model */
        NEW("new"),
        /** existing reaction opened in a new direction */
        REVERSED("reversed");

        /** label for this type */
        private String label;

        private Type(String label) {
            this.label = label;
        }

        /**
         * @return the label for this type
         */
        public String getLabel() {
            return this.label;
        }

    }

    /**
     * Construct a gapfilled reaction.
     *
     * @param reactionId	ID of the reaction
     * @param direction		direction gapfilled
     * @param type			type of gapfilling
     */
    public GapfilledReaction(String reactionId, Direction direction, Type type) {
        if (reactionId == null || direction == null || type == null)
            throw new IllegalArgumentException("Gapfilled reactions require an ID, a direction and a type.");
        this.reactionId = reactionId;
        this.direction = direction;
        this.type = type;
    }

    /**
     * @return the reaction ID
     */
    public String getReactionId() {
        return this.reactionId;
    }

    /**
     * @return the direction gapfilled
     */
    public Direction getDirection() {
        return this.direction;
    }

    /**
     * @return the type of gapfilling
     */
    public Type getType() {
        return this.type;
    }

    /**
     * @return a candidate reaction for this reaction direction
     */
    public CandidateReaction toCandidate() {
        return new CandidateReaction(this.reactionId, this.direction);
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
        if (!(obj instanceof GapfilledReaction))
            return false;
        GapfilledReaction other = (GapfilledReaction) obj;
        return this.direction == other.direction && this.reactionId.equals(other.reactionId);
    }

    @Override
    public String toString() {
        return this.reactionId + this.direction.getSymbol() + " (" + this.type.getLabel() + ")";
    }

}

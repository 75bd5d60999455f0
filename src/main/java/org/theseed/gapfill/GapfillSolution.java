/**
 *
 */
package org.theseed.gapfill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.Media;

/**
 * A gapfilling solution lists the reactions that must be added to a model (new reactions) or opened
 * in a new direction (reversed reactions) so that the target can reach a minimum objective in a
 * media.  After integration, the growth field holds the objective value actually achieved.
 */
public class GapfillSolution {

    // FIELDS
    /** media gapfilled */
    private Media media;
    /** ID of the target reaction */
    private String target;
    /** minimum objective value */
    private double minObjective;
    /** TRUE if the solution was binary-checked for minimality */
    private boolean binaryCheck;
    /** map of new reaction IDs to directions */
    private Map<String, Direction> newReactions;
    /** map of reversed reaction IDs to directions */
    private Map<String, Direction> reversedReactions;
    /** objective value achieved after integration, or NaN if it was not measured */
    private double growth;

    /**
     * Construct an empty gapfilling solution with no condition.
     */
    public GapfillSolution() {
        this(null, null, 0.0, false);
    }

    /**
     * Construct an empty gapfilling solution for a condition.
     *
     * @param media				media gapfilled
     * @param target			ID of the target reaction
     * @param minObjective		minimum objective value
     * @param binaryCheck		TRUE if the solution was binary-checked
     */
    public GapfillSolution(Media media, String target, double minObjective, boolean binaryCheck) {
        this.media = media;
        this.target = target;
        this.minObjective = minObjective;
        this.binaryCheck = binaryCheck;
        this.newReactions = new LinkedHashMap<String, Direction>();
        this.reversedReactions = new LinkedHashMap<String, Direction>();
        this.growth = Double.NaN;
    }

    /**
     * @return a copy of this solution with a different condition
     *
     * @param newMedia			media gapfilled
     * @param newTarget			ID of the target reaction
     * @param newMinObjective	minimum objective value
     * @param newBinaryCheck	TRUE if the solution was binary-checked
     */
    public GapfillSolution forCondition(Media newMedia, String newTarget, double newMinObjective, boolean newBinaryCheck) {
        GapfillSolution retVal = new GapfillSolution(newMedia, newTarget, newMinObjective, newBinaryCheck);
        retVal.newReactions.putAll(this.newReactions);
        retVal.reversedReactions.putAll(this.reversedReactions);
        return retVal;
    }

    /**
     * Add a reaction to this solution.
     *
     * @param reaction		gapfilled reaction to add
     */
    public void add(GapfilledReaction reaction) {
        this.add(reaction.getReactionId(), reaction.getDirection(), reaction.getType());
    }

    /**
     * Add a reaction to this solution.
     *
     * @param reactionId	ID of the reaction
     * @param dir			direction gapfilled
     * @param type			type of gapfilling
     */
    public void add(String reactionId, Direction dir, GapfilledReaction.Type type) {
        if (type == GapfilledReaction.Type.NEW)
            this.newReactions.put(reactionId, dir);
        else
            this.reversedReactions.put(reactionId, dir);
    }

    /**
     * @return the list of reactions in this solution, new reactions first
     */
    public List<GapfilledReaction> toList() {
        List<GapfilledReaction> retVal = new ArrayList<GapfilledReaction>(this.gapfillCount());
        for (Map.Entry<String, Direction> entry : this.newReactions.entrySet())
            retVal.add(new GapfilledReaction(entry.getKey(), entry.getValue(), GapfilledReaction.Type.NEW));
        for (Map.Entry<String, Direction> entry : this.reversedReactions.entrySet())
            retVal.add(new GapfilledReaction(entry.getKey(), entry.getValue(), GapfilledReaction.Type.REVERSED));
        return retVal;
    }

    /**
     * @return the number of reactions in this solution
     */
    public int gapfillCount() {
        return this.newReactions.size() + this.reversedReactions.size();
    }

    /**
     * @return the new reactions, as a map from ID to direction
     */
    public Map<String, Direction> getNew() {
        return Collections.unmodifiableMap(this.newReactions);
    }

    /**
     * @return the reversed reactions, as a map from ID to direction
     */
    public Map<String, Direction> getReversed() {
        return Collections.unmodifiableMap(this.reversedReactions);
    }

    /**
     * @return the media gapfilled
     */
    public Media getMedia() {
        return this.media;
    }

    /**
     * @return the target reaction ID
     */
    public String getTarget() {
        return this.target;
    }

    /**
     * @return the minimum objective value
     */
    public double getMinObjective() {
        return this.minObjective;
    }

    /**
     * @return TRUE if the solution was binary-checked
     */
    public boolean isBinaryCheck() {
        return this.binaryCheck;
    }

    /**
     * @return the growth achieved after integration, or NaN if it was not measured
     */
    public double getGrowth() {
        return this.growth;
    }

    /**
     * @param growth 	the growth achieved after integration
     */
    public void setGrowth(double growth) {
        this.growth = growth;
    }

    @Override
    public String toString() {
        return "Gapfill solution for " + (this.media == null ? "(no media)" : this.media.getId()) + "/" + this.target
                + ": new " + this.newReactions + ", reversed " + this.reversedReactions;
    }

}

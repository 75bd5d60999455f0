/**
 *
 */
package org.theseed.gapfill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.theseed.gapfill.model.Media;

/**
 * This object contains the results of a multi-media gapfilling run:  the integrated solution for each
 * successful media, the medias that could not be gapfilled, and the cumulative list of reactions
 * retained across all the medias.
 */
public class MultiGapfillResult {

    // FIELDS
    /** integration policy used */
    private IntegrationPolicy policy;
    /** map of medias to integrated solutions */
    private Map<Media, GapfillSolution> solutions;
    /** list of medias that failed */
    private List<Media> failures;
    /** cumulative list of retained gapfilled reactions */
    private List<GapfilledReaction> cumulative;
    /** reactions found unneeded by the final joint test */
    private List<GapfilledReaction> unneeded;

    /**
     * Construct an empty result.
     *
     * @param policy	integration policy used
     */
    public MultiGapfillResult(IntegrationPolicy policy) {
        this.policy = policy;
        this.solutions = new LinkedHashMap<Media, GapfillSolution>();
        this.failures = new ArrayList<Media>();
        this.cumulative = new ArrayList<GapfilledReaction>();
        this.unneeded = new ArrayList<GapfilledReaction>();
    }

    /**
     * Store the integrated solution for a media.
     *
     * @param media			media gapfilled
     * @param solution		integrated solution
     */
    public void addSolution(Media media, GapfillSolution solution) {
        this.solutions.put(media, solution);
    }

    /**
     * Record a media that could not be gapfilled.
     *
     * @param media		media that failed
     */
    public void addFailure(Media media) {
        if (! this.failures.contains(media))
            this.failures.add(media);
    }

    /**
     * @return the integration policy used
     */
    public IntegrationPolicy getPolicy() {
        return this.policy;
    }

    /**
     * @return the integrated solution for a media, or NULL if the media was not gapfilled
     *
     * @param media		media of interest
     */
    public GapfillSolution getSolution(Media media) {
        return this.solutions.get(media);
    }

    /**
     * @return the map of medias to integrated solutions
     */
    public Map<Media, GapfillSolution> getSolutions() {
        return Collections.unmodifiableMap(this.solutions);
    }

    /**
     * @return the list of medias that could not be gapfilled
     */
    public List<Media> getFailures() {
        return Collections.unmodifiableList(this.failures);
    }

    /**
     * @return TRUE if some medias failed
     */
    public boolean isPartial() {
        return ! this.failures.isEmpty();
    }

    /**
     * @return the cumulative list of retained gapfilled reactions
     */
    public List<GapfilledReaction> getCumulative() {
        return Collections.unmodifiableList(this.cumulative);
    }

    /**
     * Specify the cumulative list of retained gapfilled reactions.
     *
     * @param cumulative	list of retained reactions
     */
    public void setCumulative(List<GapfilledReaction> cumulative) {
        this.cumulative = new ArrayList<GapfilledReaction>(cumulative);
    }

    /**
     * @return the IDs of the retained gapfilled reactions
     */
    public Set<String> getRetainedReactionIds() {
        Set<String> retVal = new TreeSet<String>();
        for (GapfilledReaction item : this.cumulative)
            retVal.add(item.getReactionId());
        return retVal;
    }

    /**
     * @return the reactions found unneeded by the final joint test
     */
    public List<GapfilledReaction> getUnneeded() {
        return Collections.unmodifiableList(this.unneeded);
    }

    /**
     * Specify the reactions found unneeded by the final joint test.
     *
     * @param unneeded	list of unneeded reactions
     */
    public void setUnneeded(List<GapfilledReaction> unneeded) {
        this.unneeded = new ArrayList<GapfilledReaction>(unneeded);
    }

}

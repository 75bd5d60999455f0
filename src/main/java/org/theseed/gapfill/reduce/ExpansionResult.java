/**
 *
 */
package org.theseed.gapfill.reduce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This is the result of an expansion search.  It contains the candidates filtered by the search and,
 * if the search was aborted, the breaking reaction that caused the abort.  The special
 * {@link #NO_SOLUTION} instance indicates that no configuration of the candidates can pass the
 * test conditions.
 */
public class ExpansionResult {

    // FIELDS
    /** candidates filtered by the search */
    private List<CandidateReaction> filtered;
    /** breaking reaction that aborted the search, or NULL if the search completed */
    private CandidateReaction breaking;

    /** result returned when no solution exists */
    public static final ExpansionResult NO_SOLUTION = new ExpansionResult(Collections.emptyList(), null);

    /**
     * Construct an expansion result.
     *
     * @param filtered		list of filtered candidates
     * @param breaking		breaking reaction, or NULL if there was none
     */
    protected ExpansionResult(List<CandidateReaction> filtered, CandidateReaction breaking) {
        this.filtered = filtered;
        this.breaking = breaking;
    }

    /**
     * @return an empty result for a completed search
     */
    public static ExpansionResult empty() {
        return new ExpansionResult(new ArrayList<CandidateReaction>(), null);
    }

    /**
     * @return a result for a completed search
     *
     * @param filtered		list of filtered candidates
     */
    public static ExpansionResult of(List<CandidateReaction> filtered) {
        return new ExpansionResult(filtered, null);
    }

    /**
     * @return a result for an aborted search
     *
     * @param filtered		list of candidates filtered before the abort
     * @param breaking		breaking reaction that caused the abort
     */
    public static ExpansionResult broken(List<CandidateReaction> filtered, CandidateReaction breaking) {
        return new ExpansionResult(filtered, breaking);
    }

    /**
     * @return the list of filtered candidates
     */
    public List<CandidateReaction> getFiltered() {
        return this.filtered;
    }

    /**
     * @return the breaking reaction, or NULL if the search completed
     */
    public CandidateReaction getBreaking() {
        return this.breaking;
    }

    /**
     * @return TRUE if the search was aborted by a breaking reaction
     */
    public boolean isBroken() {
        return this.breaking != null;
    }

    /**
     * @return TRUE if this result indicates that no solution exists
     */
    public boolean isNoSolution() {
        return this == NO_SOLUTION;
    }

    @Override
    public String toString() {
        String retVal;
        if (this.isNoSolution())
            retVal = "no solution";
        else {
            retVal = "filtered " + this.filtered;
            if (this.breaking != null)
                retVal += ", broken by " + this.breaking;
        }
        return retVal;
    }

}

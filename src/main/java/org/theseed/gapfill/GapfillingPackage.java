/**
 *
 */
package org.theseed.gapfill;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.FluxSolution;
import org.theseed.gapfill.model.Media;
import org.theseed.gapfill.reduce.CandidateReaction;

/**
 * This interface describes the gapfilling problem builder used by the gapfiller.  The builder owns a
 * gapfilling model:  a copy of the live model extended with the candidate reactions of a gapfilling
 * database, with a penalty-minimizing objective.  Solving the gapfilling model yields the cheapest
 * set of candidate reactions that lets the target reach its minimum objective.
 */
public interface GapfillingPackage {

    /**
     * @return the gapfilling model
     */
    public FluxModel getModel();

    /**
     * Specify the target reaction and the minimum objective it must reach.
     *
     * @param target		ID of the target reaction
     * @param minObjective	minimum objective value, or NaN to leave the target unconstrained
     */
    public void setBaseObjective(String target, double minObjective);

    /**
     * Apply a media to the gapfilling model.
     *
     * @param media		media to apply
     */
    public void setMedia(Media media);

    /**
     * Test whether the gapfilling database can make the target reach a nonzero objective under the
     * current media.
     *
     * @param activeReactions	list to receive the candidate reactions active in the test solution
     *
     * @return TRUE if the target can be activated
     */
    public boolean testGapfillDatabase(List<CandidateReaction> activeReactions);

    /**
     * @return TRUE if the last database test failed because the test problem was infeasible
     */
    public boolean isTestInfeasible();

    /**
     * @return the candidate reactions of the gapfilling database that are active in the gapfilling model
     */
    public List<CandidateReaction> getCandidateReactions();

    /**
     * Solve the gapfilling problem for the current target and media.
     *
     * @return the solution to the gapfilling problem
     */
    public FluxSolution solve();

    /**
     * Compute a gapfilling solution from flux values.
     *
     * @param fluxValues	map of reaction IDs to direction fluxes, or NULL to use the last solve
     *
     * @return the new and reversed reactions of the solution, with no condition attached
     */
    public GapfillSolution computeGapfilledSolution(Map<String, Map<Direction, Double>> fluxValues);

    /**
     * Reduce a gapfilling solution to a minimal one.
     *
     * @param solution	solution to reduce
     *
     * @return the reduced solution
     */
    public GapfillSolution binaryCheckGapfillingSolution(GapfillSolution solution);

    /**
     * Recompute the gapfilling penalties.
     *
     * @param exclusion		reactions that should no longer be penalized, or NULL to restore the unbiased penalties
     */
    public void computeGapfillingPenalties(Collection<GapfilledReaction> exclusion);

    /**
     * Rebuild the gapfilling objective from the current penalties.
     */
    public void buildGapfillingObjectiveFunction();

    /**
     * @return the gapfilling penalties, as a map from reaction ID to direction to penalty
     */
    public Map<String, Map<Direction, Double>> getGapfillingPenalties();

    /**
     * Create the max-flux variables needed for a merged problem.
     */
    public void createMaxFluxVariables();

    /**
     * Build a merged problem with one copy of the gapfilling model per condition.  The max-flux
     * variables are shared across the copies.
     *
     * @param medias		list of medias
     * @param targets		list of target reaction IDs, parallel to the medias
     * @param thresholds	list of minimum objectives, parallel to the medias
     *
     * @return the merged problem
     */
    public MergedGapfillProblem mergeProblems(List<Media> medias, List<String> targets, List<Double> thresholds);

}

/**
 *
 */
package org.theseed.gapfill;

import java.util.Map;
import java.util.Set;

import org.theseed.gapfill.model.FluxSolution;
import org.theseed.gapfill.reduce.CandidateReaction;

/**
 * This interface describes a gapfilling problem replicated across several conditions.  Each reaction
 * direction has a max-flux variable shared by all the copies, so minimizing the weighted sum of those
 * variables finds one set of reactions that satisfies every condition.
 */
public interface MergedGapfillProblem {

    /**
     * @return the reaction directions that have shared max-flux variables
     */
    public Set<CandidateReaction> getMaxFluxKeys();

    /**
     * Specify the objective to minimize.
     *
     * @param coefficients		map of reaction directions to max-flux variable coefficients
     */
    public void setObjective(Map<CandidateReaction, Double> coefficients);

    /**
     * Solve the merged problem.
     *
     * @return the solution status and objective value
     */
    public FluxSolution solve();

    /**
     * @return the value of a max-flux variable in the last solution
     *
     * @param key		reaction direction of interest
     */
    public double getPrimal(CandidateReaction key);

}

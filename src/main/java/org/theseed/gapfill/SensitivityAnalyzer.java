/**
 *
 */
package org.theseed.gapfill;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.FluxSolution;
import org.theseed.gapfill.model.ModelReaction;
import org.theseed.gapfill.model.ModelScope;
import org.theseed.gapfill.model.Objective;

/**
 * This object determines which reactants of a biomass reaction a model cannot produce.  The analysis
 * runs on a copy of the model under its current media.  If the biomass reaction can carry flux, every
 * reactant is producible.  Otherwise each reactant is probed with a temporary demand reaction, and
 * the ones whose demand flux cannot exceed zero are reported.
 *
 * With a knockout list, the analysis is repeated with each gapfilled reaction direction blocked in
 * turn, which shows the biomass components that depend on that reaction.
 */
public class SensitivityAnalyzer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SensitivityAnalyzer.class);
    /** maximum flux for a demand probe */
    public static final double DEMAND_LIMIT = 1000.0;
    /** prefix for demand probe reaction IDs */
    public static final String DEMAND_PREFIX = "DM_probe_";
    /** minimum flux considered nonzero */
    private static final double EPSILON = 1e-8;

    /**
     * Find the biomass reactants a model cannot produce.
     *
     * @param model		model to analyze
     * @param target	ID of the biomass reaction
     *
     * @return the list of unproducible compound IDs, or NULL if the target reaction is not in the model
     */
    public List<String> findUnproducibleBiomassCompounds(FluxModel model, String target) {
        List<String> retVal = null;
        if (! model.hasReaction(target))
            log.error("{} not in model {}.", target, model.getId());
        else {
            FluxModel work = model.copy();
            retVal = this.runDependencyTest(work, target);
        }
        return retVal;
    }

    /**
     * Find the biomass reactants a model cannot produce with each of a list of reaction directions
     * knocked out.
     *
     * @param model		model to analyze
     * @param target	ID of the biomass reaction
     * @param koList	reaction directions to knock out
     *
     * @return a map from reaction ID to direction to unproducible compound IDs, or NULL if the target
     * 			reaction is not in the model
     */
    public Map<String, Map<Direction, List<String>>> findUnproducibleBiomassCompounds(FluxModel model, String target,
            Collection<GapfilledReaction> koList) {
        Map<String, Map<Direction, List<String>>> retVal = null;
        if (! model.hasReaction(target))
            log.error("{} not in model {}.", target, model.getId());
        else {
            retVal = new LinkedHashMap<String, Map<Direction, List<String>>>();
            FluxModel work = model.copy();
            for (GapfilledReaction item : koList) {
                String id = item.getReactionId();
                log.debug("Knocking out {}.", item);
                Map<Direction, List<String>> dirMap = retVal.computeIfAbsent(id,
                        x -> new EnumMap<Direction, List<String>>(Direction.class));
                if (! work.hasReaction(id)) {
                    log.info("Reaction {} not in model during sensitivity analysis.", id);
                    dirMap.put(item.getDirection(), new ArrayList<String>());
                } else {
                    try (ModelScope scope = work.openScope()) {
                        work.zeroBound(id, item.getDirection());
                        dirMap.put(item.getDirection(), this.runDependencyTest(work, target));
                    }
                }
            }
        }
        return retVal;
    }

    /**
     * Compute the unproducible biomass reactants in a working model.  The model is restored
     * afterward.
     *
     * @param work		working model
     * @param target	ID of the biomass reaction
     *
     * @return the list of unproducible compound IDs
     */
    private List<String> runDependencyTest(FluxModel work, String target) {
        List<String> retVal = new ArrayList<String>();
        try (ModelScope scope = work.openScope()) {
            work.setObjective(Objective.of(target));
            FluxSolution solution = work.solve();
            if (solution.isOptimal() && solution.getObjectiveValue() > EPSILON)
                log.debug("Biomass reaction {} is active:  all reactants are producible.", target);
            else {
                ModelReaction biomass = work.getReaction(target);
                for (ModelReaction.Stoich reactant : biomass.getReactants()) {
                    String compound = reactant.getMetabolite();
                    if (! this.isProducible(work, compound)) {
                        log.debug("Compound {} cannot be produced.", compound);
                        retVal.add(compound);
                    }
                }
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if a compound can be produced in the working model
     *
     * @param work			working model
     * @param compound		ID of the compound to probe
     */
    private boolean isProducible(FluxModel work, String compound) {
        boolean retVal;
        try (ModelScope scope = work.openScope()) {
            String demandId = DEMAND_PREFIX + compound;
            if (! work.hasReaction(demandId)) {
                ModelReaction demand = new ModelReaction(demandId, "Demand for " + compound, 0.0, DEMAND_LIMIT);
                demand.addStoich(compound, -1.0);
                work.addReaction(demand);
            }
            work.setObjective(Objective.of(demandId));
            FluxSolution solution = work.solve();
            retVal = (solution.isOptimal() && solution.getObjectiveValue() > EPSILON);
        }
        return retVal;
    }

}

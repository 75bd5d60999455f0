/**
 *
 */
package org.theseed.gapfill.model;

import java.util.HashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * This is a flux model whose objective values come from scripts instead of a solver.  Each objective
 * ID maps to a function of the model state.  It is used to drive the search algorithms through exact
 * scenarios.
 */
public class ScriptedFluxModel extends FluxModel {

    // FIELDS
    /** map of objective IDs to value scripts */
    private Map<String, ToDoubleFunction<ScriptedFluxModel>> scripts;
    /** status to report instead of solving, or NULL to solve normally */
    private FluxSolution.Status forcedStatus;
    /** number of solves performed */
    private int solveCount;

    /**
     * Construct a scripted model.
     *
     * @param id	model identifier
     */
    public ScriptedFluxModel(String id) {
        super(id);
        this.scripts = new HashMap<String, ToDoubleFunction<ScriptedFluxModel>>();
        this.forcedStatus = null;
        this.solveCount = 0;
    }

    @Override
    protected FluxModel newInstance(String newId) {
        ScriptedFluxModel retVal = new ScriptedFluxModel(newId);
        retVal.scripts.putAll(this.scripts);
        retVal.forcedStatus = this.forcedStatus;
        return retVal;
    }

    @Override
    public FluxSolution solve() {
        this.solveCount++;
        FluxSolution retVal;
        if (this.forcedStatus != null)
            retVal = FluxSolution.failed(this.forcedStatus);
        else {
            ToDoubleFunction<ScriptedFluxModel> script = this.scripts.get(this.getObjective().getId());
            double value = (script == null ? 0.0 : script.applyAsDouble(this));
            retVal = new FluxSolution(FluxSolution.Status.OPTIMAL, value, new HashMap<String, Double>());
        }
        return retVal;
    }

    /**
     * Add a reaction that is open in both directions.
     *
     * @param id	ID of the reaction
     *
     * @return this object, for chaining
     */
    public ScriptedFluxModel reaction(String id) {
        this.addReaction(new ModelReaction(id, id, -1000.0, 1000.0));
        return this;
    }

    /**
     * Specify the script for an objective.
     *
     * @param objectiveId	ID of the objective
     * @param script		function computing the objective value from the model
     *
     * @return this object, for chaining
     */
    public ScriptedFluxModel script(String objectiveId, ToDoubleFunction<ScriptedFluxModel> script) {
        this.scripts.put(objectiveId, script);
        return this;
    }

    /**
     * @return TRUE if a reaction can carry forward flux
     *
     * @param id	ID of the reaction
     */
    public boolean on(String id) {
        return this.getUpperBound(id) > 0.0;
    }

    /**
     * Force every solve to report a failure status.
     *
     * @param status	status to report, or NULL to solve normally
     */
    public void setForcedStatus(FluxSolution.Status status) {
        this.forcedStatus = status;
    }

    /**
     * @return the number of solves performed
     */
    public int getSolveCount() {
        return this.solveCount;
    }

    /**
     * Reset the solve counter.
     */
    public void resetSolveCount() {
        this.solveCount = 0;
    }

}

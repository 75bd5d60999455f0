/**
 *
 */
package org.theseed.gapfill.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

/**
 * This is a flux model solved by linear programming.  Each solve builds a fresh ojAlgo problem:
 * one variable per reaction, bounded by the reaction bounds; one steady-state mass-balance
 * constraint per metabolite; and the current objective as the variable weights.
 */
public class LinearFluxModel extends FluxModel {

    /**
     * Construct an empty linear flux model.
     *
     * @param id	identifier for the model
     */
    public LinearFluxModel(String id) {
        super(id);
    }

    @Override
    protected FluxModel newInstance(String newId) {
        return new LinearFluxModel(newId);
    }

    @Override
    public FluxSolution solve() {
        FluxSolution retVal;
        Objective objective = this.getObjective();
        if (objective == null)
            throw new IllegalStateException("No objective set for model " + this.getId() + ".");
        ExpressionsBasedModel problem = new ExpressionsBasedModel();
        // Create the flux variables.  The variable index matches the position in this list.
        List<ModelReaction> reactions = new ArrayList<ModelReaction>(this.getReactions());
        Map<String, Variable> varMap = new HashMap<String, Variable>(reactions.size() * 4 / 3 + 1);
        for (ModelReaction reaction : reactions) {
            Variable var = problem.addVariable(reaction.getId());
            setLimits(var, reaction.getLowerBound(), reaction.getUpperBound());
            varMap.put(reaction.getId(), var);
        }
        // Build the mass-balance constraints.
        Map<String, Expression> balances = new HashMap<String, Expression>();
        for (ModelReaction reaction : reactions) {
            Variable var = varMap.get(reaction.getId());
            for (ModelReaction.Stoich stoich : reaction.getMetabolites()) {
                Expression balance = balances.computeIfAbsent(stoich.getMetabolite(),
                        x -> problem.addExpression("mb_" + x).level(BigDecimal.ZERO));
                balance.set(var, BigDecimal.valueOf(stoich.getCoeff()));
            }
        }
        // Apply the objective weights.
        for (Map.Entry<String, Double> term : objective.getCoefficients().entrySet()) {
            Variable var = varMap.get(term.getKey());
            if (var == null)
                log.warn("Objective reaction {} not found in model {}.", term.getKey(), this.getId());
            else
                var.weight(BigDecimal.valueOf(term.getValue()));
        }
        Optimisation.Result result = (objective.isMaximize() ? problem.maximise() : problem.minimise());
        Optimisation.State state = result.getState();
        if (state.isOptimal()) {
            Map<String, Double> fluxes = new LinkedHashMap<String, Double>(reactions.size() * 4 / 3 + 1);
            for (int i = 0; i < reactions.size(); i++)
                fluxes.put(reactions.get(i).getId(), result.doubleValue(i));
            // Compute the objective from the fluxes so it does not depend on solver scaling.
            double value = 0.0;
            for (Map.Entry<String, Double> term : objective.getCoefficients().entrySet())
                value += term.getValue() * fluxes.getOrDefault(term.getKey(), 0.0);
            retVal = new FluxSolution(FluxSolution.Status.OPTIMAL, value, fluxes);
        } else if (state == Optimisation.State.UNBOUNDED)
            retVal = FluxSolution.failed(FluxSolution.Status.UNBOUNDED);
        else if (! state.isFeasible())
            retVal = FluxSolution.failed(FluxSolution.Status.INFEASIBLE);
        else
            retVal = FluxSolution.failed(FluxSolution.Status.FAILED);
        log.debug("Model {} solved with state {}.", this.getId(), state);
        return retVal;
    }

    /**
     * Set the limits of a flux variable.  Infinite bounds leave the variable unlimited on that side.
     *
     * @param var		variable to limit
     * @param lower		lower bound
     * @param upper		upper bound
     */
    private static void setLimits(Variable var, double lower, double upper) {
        if (Double.isFinite(lower))
            var.lower(BigDecimal.valueOf(lower));
        if (Double.isFinite(upper))
            var.upper(BigDecimal.valueOf(upper));
    }

}

/**
 *
 */
package org.theseed.gapfill.model;

import java.util.Collections;
import java.util.Map;

/**
 * This object contains the result of a single flux-balance solve:  the solver status, the
 * objective value, and the flux through each reaction.
 */
public class FluxSolution {

    // FIELDS
    /** solver status */
    private Status status;
    /** optimal objective value */
    private double objectiveValue;
    /** map of reaction IDs to fluxes */
    private Map<String, Double> fluxes;

    /**
     * This enumeration describes the outcome of a solve.
     */
    public static enum Status {
        OPTIMAL, INFEASIBLE, UNBOUNDED, FAILED;
    }

    /**
     * Construct a flux solution.
     *
     * @param status			solver status
     * @param objectiveValue	objective value (ignored if the status is not optimal)
     * @param fluxes			map of reaction IDs to fluxes
     */
    public FluxSolution(Status status, double objectiveValue, Map<String, Double> fluxes) {
        this.status = status;
        this.objectiveValue = (status == Status.OPTIMAL ? objectiveValue : Double.NaN);
        this.fluxes = Collections.unmodifiableMap(fluxes);
    }

    /**
     * @return a solution object for a failed solve
     *
     * @param status	non-optimal status
     */
    public static FluxSolution failed(Status status) {
        return new FluxSolution(status, Double.NaN, Collections.emptyMap());
    }

    /**
     * @return the solver status
     */
    public Status getStatus() {
        return this.status;
    }

    /**
     * @return TRUE if the solve was optimal
     */
    public boolean isOptimal() {
        return this.status == Status.OPTIMAL;
    }

    /**
     * @return the objective value, or NaN if the solve was not optimal
     */
    public double getObjectiveValue() {
        return this.objectiveValue;
    }

    /**
     * @return the objective value, or zero if the solve was not optimal
     */
    public double getObjectiveOrZero() {
        return (this.isOptimal() ? this.objectiveValue : 0.0);
    }

    /**
     * @return the flux through a reaction (0 if the reaction is not in the solution)
     *
     * @param reactionId	ID of the reaction of interest
     */
    public double getFlux(String reactionId) {
        return this.fluxes.getOrDefault(reactionId, 0.0);
    }

    /**
     * @return the flux map
     */
    public Map<String, Double> getFluxes() {
        return this.fluxes;
    }

    @Override
    public String toString() {
        String retVal;
        if (this.isOptimal())
            retVal = "optimal:" + this.objectiveValue;
        else
            retVal = this.status.name().toLowerCase();
        return retVal;
    }

}

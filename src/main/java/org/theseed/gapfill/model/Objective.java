/**
 *
 */
package org.theseed.gapfill.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An objective is a linear expression over reaction fluxes, with a direction of optimization.
 * The ID is the textual form of the expression, and is used to identify the objective in caches.
 * Objectives are immutable.
 */
public class Objective {

    // FIELDS
    /** map of reaction IDs to coefficients */
    private Map<String, Double> coefficients;
    /** TRUE to maximize, FALSE to minimize */
    private boolean maximize;
    /** identifier */
    private String id;

    /**
     * Construct an objective from a coefficient map.
     *
     * @param coefficients	map of reaction IDs to coefficients
     * @param maximize		TRUE to maximize, FALSE to minimize
     */
    public Objective(Map<String, Double> coefficients, boolean maximize) {
        if (coefficients.isEmpty())
            throw new IllegalArgumentException("An objective must have at least one term.");
        this.coefficients = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(coefficients));
        this.maximize = maximize;
        if (coefficients.size() == 1 && coefficients.values().iterator().next() == 1.0)
            this.id = coefficients.keySet().iterator().next();
        else
            this.id = coefficients.entrySet().stream().map(x -> x.getValue() + "*" + x.getKey())
                    .collect(Collectors.joining(" + "));
    }

    /**
     * @return an objective that maximizes the flux through a single reaction
     *
     * @param reactionId	ID of the reaction to maximize
     */
    public static Objective of(String reactionId) {
        return new Objective(Map.of(reactionId, 1.0), true);
    }

    /**
     * @return a copy of this objective with the specified direction
     *
     * @param max	TRUE to maximize, FALSE to minimize
     */
    public Objective withDirection(boolean max) {
        Objective retVal = this;
        if (max != this.maximize)
            retVal = new Objective(this.coefficients, max);
        return retVal;
    }

    /**
     * @return the coefficient map
     */
    public Map<String, Double> getCoefficients() {
        return this.coefficients;
    }

    /**
     * @return TRUE if this objective is maximized
     */
    public boolean isMaximize() {
        return this.maximize;
    }

    /**
     * @return the objective identifier
     */
    public String getId() {
        return this.id;
    }

    @Override
    public String toString() {
        return (this.maximize ? "max " : "min ") + this.id;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.coefficients.hashCode();
        result = prime * result + (this.maximize ? 1231 : 1237);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Objective other = (Objective) obj;
        if (! this.coefficients.equals(other.coefficients))
            return false;
        if (this.maximize != other.maximize)
            return false;
        return true;
    }

}

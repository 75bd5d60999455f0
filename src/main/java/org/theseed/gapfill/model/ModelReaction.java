/**
 *
 */
package org.theseed.gapfill.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents a reaction present in a flux model.  The reaction contains the
 * stoichiometry of the compounds involved, the flux bounds, and the rule for the genes that
 * trigger it.  The bounds can only be changed through the owning {@link FluxModel}, so that
 * every change can be journaled by an open {@link ModelScope}.
 */
public class ModelReaction implements Comparable<ModelReaction> {

    // FIELDS
    /** reaction identifier */
    private String id;
    /** name of the reaction */
    private String name;
    /** lower flux bound */
    private double lowerBound;
    /** upper flux bound */
    private double upperBound;
    /** rule for triggering the reaction */
    private String geneRule;
    /** metabolite list */
    private List<Stoich> metabolites;
    /** annotation notes */
    private Map<String, String> notes;

    /**
     * This is a simple object to represent stoichiometry.  The sort order puts reactants
     * before products.
     */
    public static class Stoich implements Comparable<Stoich> {

        /** stoichiometric coefficient */
        private double coefficient;
        /** metabolite identifier */
        private String metabolite;

        /**
         * Construct a new stoichiometric representation.
         *
         * @param coeff		coefficient (negative for reactants)
         * @param compound	ID of the metabolite
         */
        public Stoich(double coeff, String compound) {
            this.coefficient = coeff;
            this.metabolite = compound;
        }

        @Override
        public int compareTo(Stoich o) {
            int retVal = Double.compare(this.coefficient, o.coefficient);
            if (retVal == 0)
                retVal = this.metabolite.compareTo(o.metabolite);
            return retVal;
        }

        /**
         * @return the signed coefficient
         */
        public double getCoeff() {
            return this.coefficient;
        }

        /**
         * @return TRUE for a product, FALSE for a reactant
         */
        public boolean isProduct() {
            return (this.coefficient > 0);
        }

        /**
         * @return the metabolite ID
         */
        public String getMetabolite() {
            return this.metabolite;
        }

        @Override
        public String toString() {
            double coeff = Math.abs(this.coefficient);
            String retVal;
            if (coeff == 1.0)
                retVal = this.metabolite;
            else
                retVal = String.format("%g*%s", coeff, this.metabolite);
            return retVal;
        }

    }

    /**
     * Construct a new reaction.
     *
     * @param id			ID of the reaction
     * @param name			descriptive name
     * @param lower			lower flux bound
     * @param upper			upper flux bound
     */
    public ModelReaction(String id, String name, double lower, double upper) {
        if (StringUtils.isBlank(id))
            throw new IllegalArgumentException("Reaction ID cannot be blank.");
        if (lower > upper)
            throw new IllegalArgumentException("Lower bound " + lower + " exceeds upper bound " + upper
                    + " for reaction " + id + ".");
        this.id = id;
        this.name = (name == null ? id : name);
        this.lowerBound = lower;
        this.upperBound = upper;
        this.geneRule = "";
        this.metabolites = new ArrayList<Stoich>();
        this.notes = new TreeMap<String, String>();
    }

    /**
     * Add a metabolite to this reaction.
     *
     * @param compound	ID of the metabolite
     * @param coeff		stoichiometric coefficient (negative for reactants)
     *
     * @return this object, for chaining
     */
    public ModelReaction addStoich(String compound, double coeff) {
        this.metabolites.add(new Stoich(coeff, compound));
        Collections.sort(this.metabolites);
        return this;
    }

    /**
     * @return a copy of this reaction, suitable for adding to a different model
     */
    public ModelReaction copy() {
        ModelReaction retVal = new ModelReaction(this.id, this.name, this.lowerBound, this.upperBound);
        retVal.metabolites.addAll(this.metabolites);
        retVal.geneRule = this.geneRule;
        retVal.notes.putAll(this.notes);
        return retVal;
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the reaction name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the lower flux bound
     */
    public double getLowerBound() {
        return this.lowerBound;
    }

    /**
     * @return the upper flux bound
     */
    public double getUpperBound() {
        return this.upperBound;
    }

    /**
     * Store new flux bounds.  Only the owning model calls this.
     *
     * @param lower		new lower bound
     * @param upper		new upper bound
     */
    protected void storeBounds(double lower, double upper) {
        this.lowerBound = lower;
        this.upperBound = upper;
    }

    /**
     * @return TRUE if the reaction can currently carry flux in the specified direction
     *
     * @param dir	direction of interest
     */
    public boolean isActive(Direction dir) {
        boolean retVal;
        if (dir == Direction.FORWARD)
            retVal = this.upperBound > 0.0;
        else
            retVal = this.lowerBound < 0.0;
        return retVal;
    }

    /**
     * @return TRUE if both bounds are zero
     */
    public boolean isBlocked() {
        return (this.lowerBound == 0.0 && this.upperBound == 0.0);
    }

    /**
     * @return the gene rule (empty if the reaction has no genes)
     */
    public String getGeneRule() {
        return this.geneRule;
    }

    /**
     * Specify a new gene rule.
     *
     * @param rule	new gene rule
     */
    public void setGeneRule(String rule) {
        this.geneRule = (rule == null ? "" : rule);
    }

    /**
     * @return TRUE if this reaction has genes
     */
    public boolean hasGenes() {
        return ! StringUtils.isBlank(this.geneRule);
    }

    /**
     * @return the components of the reaction (reactants and products with stoichiometric coefficients)
     */
    public List<Stoich> getMetabolites() {
        return this.metabolites;
    }

    /**
     * @return the reactants of this reaction
     */
    public List<Stoich> getReactants() {
        return this.metabolites.stream().filter(x -> ! x.isProduct()).collect(Collectors.toList());
    }

    /**
     * @return the value of an annotation note, or NULL if it is not present
     *
     * @param key	name of the note
     */
    public String getNote(String key) {
        return this.notes.get(key);
    }

    /**
     * Store an annotation note.
     *
     * @param key		name of the note
     * @param value		value to store
     */
    public void setNote(String key, String value) {
        this.notes.put(key, value);
    }

    /**
     * @return the reaction formula
     */
    public String getFormula() {
        String left = this.metabolites.stream().filter(x -> ! x.isProduct()).map(x -> x.toString())
                .collect(Collectors.joining(" + "));
        String right = this.metabolites.stream().filter(x -> x.isProduct()).map(x -> x.toString())
                .collect(Collectors.joining(" + "));
        String arrow;
        if (this.lowerBound < 0.0 && this.upperBound > 0.0)
            arrow = " <=> ";
        else if (this.lowerBound < 0.0)
            arrow = " <-- ";
        else
            arrow = " --> ";
        return left + arrow + right;
    }

    @Override
    public int compareTo(ModelReaction o) {
        return this.id.compareTo(o.id);
    }

    @Override
    public String toString() {
        return "Reaction " + this.id + "(" + this.name + ")";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.id.hashCode();
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
        ModelReaction other = (ModelReaction) obj;
        if (! this.id.equals(other.id))
            return false;
        return true;
    }

}

/**
 *
 */
package org.theseed.gapfill.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object represents a constraint-based metabolic model that can be queried for an optimal
 * objective value.  It holds the reactions with their flux bounds, the exchange reactions that
 * connect the model to its media, the current media and the current objective.  The subclass
 * supplies the actual solver.
 *
 * All mutations pass through this class so that an open {@link ModelScope} can journal the
 * original values.  A scope that is closed without being committed restores the model exactly
 * as it was when the scope was opened.
 */
public abstract class FluxModel {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FluxModel.class);
    /** model identifier */
    private String id;
    /** map of reaction IDs to reactions, in insertion order */
    private Map<String, ModelReaction> reactionMap;
    /** map of compound IDs to exchange reaction IDs */
    private Map<String, String> exchangeMap;
    /** current media, or NULL if none has been applied */
    private Media media;
    /** current objective, or NULL if none has been set */
    private Objective objective;
    /** uptake allowed for exchange compounds not in the media */
    private double defaultUptake;
    /** stack of open scopes, innermost first */
    private Deque<ModelScope> scopes;

    /**
     * Construct an empty flux model.
     *
     * @param id	identifier for this model
     */
    public FluxModel(String id) {
        this.id = id;
        this.reactionMap = new LinkedHashMap<String, ModelReaction>();
        this.exchangeMap = new LinkedHashMap<String, String>();
        this.media = null;
        this.objective = null;
        this.defaultUptake = 0.0;
        this.scopes = new ArrayDeque<ModelScope>();
    }

    /**
     * @return a new, empty model of the same type
     *
     * @param newId		identifier for the new model
     */
    protected abstract FluxModel newInstance(String newId);

    /**
     * Solve the model for the current objective under the current bounds.  The solve is always
     * fresh:  no result is cached.
     *
     * @return the flux solution
     */
    public abstract FluxSolution solve();

    /**
     * @return a scratch copy of this model (reactions, exchanges, media, and objective)
     */
    public FluxModel copy() {
        FluxModel retVal = this.newInstance(this.id);
        for (ModelReaction reaction : this.reactionMap.values())
            retVal.reactionMap.put(reaction.getId(), reaction.copy());
        retVal.exchangeMap.putAll(this.exchangeMap);
        retVal.media = this.media;
        retVal.objective = this.objective;
        retVal.defaultUptake = this.defaultUptake;
        return retVal;
    }

    /**
     * @return the model identifier
     */
    public String getId() {
        return this.id;
    }

    /**
     * Add a reaction to the model.
     *
     * @param reaction	reaction to add
     *
     * @throws IllegalArgumentException		if a reaction with the same ID is already present
     */
    public void addReaction(ModelReaction reaction) {
        if (this.reactionMap.containsKey(reaction.getId()))
            throw new IllegalArgumentException("Reaction " + reaction.getId() + " is already in model " + this.id + ".");
        this.reactionMap.put(reaction.getId(), reaction);
        ModelScope scope = this.scopes.peek();
        if (scope != null)
            scope.recordAdded(reaction.getId());
    }

    /**
     * Add an exchange reaction for a compound.  The exchange consumes the compound, so negative
     * flux represents uptake.  Its lower bound will be controlled by the media.
     *
     * @param compound		ID of the exchanged compound
     * @param reactionId	ID of the exchange reaction
     * @param maxExcretion	maximum excretion rate
     *
     * @return the new exchange reaction
     */
    public ModelReaction addExchange(String compound, String reactionId, double maxExcretion) {
        ModelReaction retVal = new ModelReaction(reactionId, "Exchange for " + compound,
                -this.getUptakeFor(compound), maxExcretion);
        retVal.addStoich(compound, -1.0);
        this.addReaction(retVal);
        this.exchangeMap.put(compound, reactionId);
        return retVal;
    }

    /**
     * @return the uptake currently allowed for a compound
     *
     * @param compound	ID of the compound of interest
     */
    private double getUptakeFor(String compound) {
        double retVal = this.defaultUptake;
        if (this.media != null)
            retVal = this.media.getUptake(compound, this.defaultUptake);
        return retVal;
    }

    /**
     * Remove reactions from the model.  Reactions not in the model are ignored.
     *
     * @param reactionIds	IDs of the reactions to remove
     *
     * @return the number of reactions removed
     */
    public int removeReactions(Collection<String> reactionIds) {
        int retVal = 0;
        ModelScope scope = this.scopes.peek();
        for (String reactionId : reactionIds) {
            ModelReaction reaction = this.reactionMap.remove(reactionId);
            if (reaction == null)
                log.debug("Reaction {} not found for removal from {}.", reactionId, this.id);
            else {
                retVal++;
                if (scope != null)
                    scope.recordRemoved(reaction);
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if the reaction is in this model
     *
     * @param reactionId	ID of the reaction of interest
     */
    public boolean hasReaction(String reactionId) {
        return this.reactionMap.containsKey(reactionId);
    }

    /**
     * @return the reaction with the specified ID, or NULL if none exists
     *
     * @param reactionId	ID of the desired reaction
     */
    public ModelReaction getReaction(String reactionId) {
        return this.reactionMap.get(reactionId);
    }

    /**
     * @return the reaction with the specified ID
     *
     * @param reactionId	ID of the desired reaction
     *
     * @throws IllegalArgumentException		if the reaction is not in the model
     */
    protected ModelReaction requireReaction(String reactionId) {
        ModelReaction retVal = this.reactionMap.get(reactionId);
        if (retVal == null)
            throw new IllegalArgumentException("Reaction " + reactionId + " not found in model " + this.id + ".");
        return retVal;
    }

    /**
     * @return all the reactions in this model, in insertion order
     */
    public Collection<ModelReaction> getReactions() {
        return Collections.unmodifiableCollection(this.reactionMap.values());
    }

    /**
     * @return the IDs of all the reactions in this model
     */
    public Set<String> getReactionIds() {
        return Collections.unmodifiableSet(this.reactionMap.keySet());
    }

    /**
     * @return the number of reactions in the model
     */
    public int size() {
        return this.reactionMap.size();
    }

    /**
     * @return the lower bound of a reaction
     *
     * @param reactionId	ID of the reaction of interest
     */
    public double getLowerBound(String reactionId) {
        return this.requireReaction(reactionId).getLowerBound();
    }

    /**
     * @return the upper bound of a reaction
     *
     * @param reactionId	ID of the reaction of interest
     */
    public double getUpperBound(String reactionId) {
        return this.requireReaction(reactionId).getUpperBound();
    }

    /**
     * Specify both bounds of a reaction.
     *
     * @param reactionId	ID of the reaction to change
     * @param lower			new lower bound
     * @param upper			new upper bound
     */
    public void setBounds(String reactionId, double lower, double upper) {
        ModelReaction reaction = this.requireReaction(reactionId);
        this.journalBounds(reaction);
        reaction.storeBounds(lower, upper);
    }

    /**
     * Specify the lower bound of a reaction.
     *
     * @param reactionId	ID of the reaction to change
     * @param lower			new lower bound
     */
    public void setLowerBound(String reactionId, double lower) {
        ModelReaction reaction = this.requireReaction(reactionId);
        this.journalBounds(reaction);
        reaction.storeBounds(lower, reaction.getUpperBound());
    }

    /**
     * Specify the upper bound of a reaction.
     *
     * @param reactionId	ID of the reaction to change
     * @param upper			new upper bound
     */
    public void setUpperBound(String reactionId, double upper) {
        ModelReaction reaction = this.requireReaction(reactionId);
        this.journalBounds(reaction);
        reaction.storeBounds(reaction.getLowerBound(), upper);
    }

    /**
     * @return the bound controlling flux in the specified direction
     *
     * @param reactionId	ID of the reaction of interest
     * @param dir			direction of interest
     */
    public double getBound(String reactionId, Direction dir) {
        return dir.getBound(this.requireReaction(reactionId));
    }

    /**
     * Specify the bound controlling flux in the specified direction.
     *
     * @param reactionId	ID of the reaction to change
     * @param dir			direction to change
     * @param value			new bound value
     */
    public void setBound(String reactionId, Direction dir, double value) {
        if (dir == Direction.FORWARD)
            this.setUpperBound(reactionId, value);
        else
            this.setLowerBound(reactionId, value);
    }

    /**
     * Block flux in the specified direction.
     *
     * @param reactionId	ID of the reaction to change
     * @param dir			direction to block
     *
     * @return the original value of the bound
     */
    public double zeroBound(String reactionId, Direction dir) {
        double retVal = this.getBound(reactionId, dir);
        this.setBound(reactionId, dir, 0.0);
        return retVal;
    }

    /**
     * Record the current bounds of a reaction in the innermost open scope.
     *
     * @param reaction	reaction about to be changed
     */
    private void journalBounds(ModelReaction reaction) {
        ModelScope scope = this.scopes.peek();
        if (scope != null)
            scope.recordBounds(reaction);
    }

    /**
     * Apply a media to the model.  The lower bound of each exchange reaction is set to allow the
     * uptake specified by the media, or the default uptake if the compound is not in the media.
     *
     * @param newMedia	media to apply
     */
    public void setMedia(Media newMedia) {
        ModelScope scope = this.scopes.peek();
        if (scope != null)
            scope.recordMedia(this.media);
        this.media = newMedia;
        for (Map.Entry<String, String> exchange : this.exchangeMap.entrySet()) {
            String reactionId = exchange.getValue();
            if (this.reactionMap.containsKey(reactionId))
                this.setLowerBound(reactionId, -this.getUptakeFor(exchange.getKey()));
        }
    }

    /**
     * @return the current media, or NULL if no media has been applied
     */
    public Media getMedia() {
        return this.media;
    }

    /**
     * Specify the uptake rate for exchange compounds not found in the media.  This takes
     * effect the next time a media is applied.
     *
     * @param uptake	default uptake rate
     */
    public void setDefaultUptake(double uptake) {
        this.defaultUptake = uptake;
    }

    /**
     * @return the exchange reaction ID for a compound, or NULL if there is none
     *
     * @param compound	ID of the compound of interest
     */
    public String getExchange(String compound) {
        return this.exchangeMap.get(compound);
    }

    /**
     * Specify a new objective.
     *
     * @param newObjective	objective to use
     */
    public void setObjective(Objective newObjective) {
        ModelScope scope = this.scopes.peek();
        if (scope != null)
            scope.recordObjective(this.objective);
        this.objective = newObjective;
    }

    /**
     * @return the current objective, or NULL if none has been set
     */
    public Objective getObjective() {
        return this.objective;
    }

    /**
     * @return a snapshot of the current media, objective and exchange lower bounds
     */
    public Environment saveEnvironment() {
        Map<String, Double> exchangeBounds = new LinkedHashMap<String, Double>();
        for (String reactionId : this.exchangeMap.values()) {
            ModelReaction reaction = this.reactionMap.get(reactionId);
            if (reaction != null)
                exchangeBounds.put(reactionId, reaction.getLowerBound());
        }
        return new Environment(this.media, this.objective, exchangeBounds);
    }

    /**
     * Put back a saved media, objective and set of exchange lower bounds.  The changes are journaled
     * like any other.  Exchange reactions no longer in the model are skipped.
     *
     * @param environment	snapshot to restore
     */
    public void restoreEnvironment(Environment environment) {
        ModelScope scope = this.scopes.peek();
        if (scope != null)
            scope.recordMedia(this.media);
        this.media = environment.media;
        this.setObjective(environment.objective);
        for (Map.Entry<String, Double> bound : environment.exchangeBounds.entrySet()) {
            if (this.reactionMap.containsKey(bound.getKey()))
                this.setLowerBound(bound.getKey(), bound.getValue());
        }
    }

    /**
     * This class holds the media, objective and exchange lower bounds of a model at a point in time.
     */
    public static class Environment {

        // FIELDS
        /** saved media, or NULL if there was none */
        private Media media;
        /** saved objective, or NULL if there was none */
        private Objective objective;
        /** map of exchange reaction IDs to saved lower bounds */
        private Map<String, Double> exchangeBounds;

        private Environment(Media media, Objective objective, Map<String, Double> exchangeBounds) {
            this.media = media;
            this.objective = objective;
            this.exchangeBounds = exchangeBounds;
        }

        /**
         * @return the saved media, or NULL if there was none
         */
        public Media getMedia() {
            return this.media;
        }

        /**
         * @return the saved objective, or NULL if there was none
         */
        public Objective getObjective() {
            return this.objective;
        }

    }

    /**
     * Open a new transactional scope.  Until the scope is closed, every change to the model is
     * journaled.  Closing the scope without committing it reverts the changes.
     *
     * @return the new scope
     */
    public ModelScope openScope() {
        ModelScope retVal = new ModelScope(this, this.scopes.peek());
        this.scopes.push(retVal);
        return retVal;
    }

    /**
     * @return the number of open scopes
     */
    public int getScopeDepth() {
        return this.scopes.size();
    }

    /**
     * Remove a scope from the scope stack.
     *
     * @param scope		scope being closed
     *
     * @throws IllegalStateException	if the scope is not the innermost open scope
     */
    protected void popScope(ModelScope scope) {
        if (this.scopes.peek() != scope)
            throw new IllegalStateException("Scopes for model " + this.id + " must be closed innermost first.");
        this.scopes.pop();
    }

    /**
     * Restore the bounds of a reaction without journaling.
     *
     * @param reactionId	ID of the reaction to restore
     * @param lower			original lower bound
     * @param upper			original upper bound
     */
    protected void restoreBounds(String reactionId, double lower, double upper) {
        ModelReaction reaction = this.reactionMap.get(reactionId);
        if (reaction == null)
            log.debug("Reaction {} no longer in model {}:  bounds not restored.", reactionId, this.id);
        else
            reaction.storeBounds(lower, upper);
    }

    /**
     * Restore the media without journaling or changing any bounds.
     *
     * @param oldMedia	original media
     */
    protected void restoreMedia(Media oldMedia) {
        this.media = oldMedia;
    }

    /**
     * Restore the objective without journaling.
     *
     * @param oldObjective	original objective
     */
    protected void restoreObjective(Objective oldObjective) {
        this.objective = oldObjective;
    }

    /**
     * Remove a reaction without journaling.
     *
     * @param reactionId	ID of the reaction to discard
     */
    protected void discardReaction(String reactionId) {
        this.reactionMap.remove(reactionId);
    }

    /**
     * Put back a removed reaction without journaling.
     *
     * @param reaction	reaction to put back
     */
    protected void reinstateReaction(ModelReaction reaction) {
        this.reactionMap.putIfAbsent(reaction.getId(), reaction);
    }

    /**
     * @return a text description of the current problem, for diagnostics
     */
    public String describeProblem() {
        List<String> lines = new ArrayList<String>(this.reactionMap.size() + 2);
        lines.add("Model " + this.id + ", objective " + this.objective + ", media " + this.media);
        for (ModelReaction reaction : this.reactionMap.values())
            lines.add(String.format("%s\t[%g, %g]\t%s", reaction.getId(), reaction.getLowerBound(),
                    reaction.getUpperBound(), reaction.getFormula()));
        return String.join(System.lineSeparator(), lines);
    }

    @Override
    public String toString() {
        return "Flux model " + this.id + " (" + this.reactionMap.size() + " reactions)";
    }

}

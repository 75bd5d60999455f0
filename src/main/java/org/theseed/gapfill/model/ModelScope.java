/**
 *
 */
package org.theseed.gapfill.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/**
 * A model scope is a transaction against a {@link FluxModel}.  While the scope is open, the model
 * journals the first-seen original value of everything it changes:  reaction bounds, the media,
 * the objective, and the reactions added or removed.  When the scope is closed, the journal is
 * replayed to restore the model, unless the scope was committed, in which case the journal is
 * folded into the enclosing scope (if any).
 *
 * Scopes are intended for use in try-with-resources blocks, so the restore happens on every exit
 * path.  They must be closed innermost first.
 */
public class ModelScope implements AutoCloseable {

    // FIELDS
    /** model being journaled */
    private FluxModel model;
    /** enclosing scope, or NULL if this is the outermost */
    private ModelScope parent;
    /** map of reaction IDs to original bounds (lower, upper) */
    private Map<String, double[]> boundMap;
    /** TRUE if the media has been journaled */
    private boolean mediaSaved;
    /** original media */
    private Media savedMedia;
    /** TRUE if the objective has been journaled */
    private boolean objectiveSaved;
    /** original objective */
    private Objective savedObjective;
    /** IDs of reactions added in this scope */
    private List<String> added;
    /** reactions removed in this scope */
    private List<ModelReaction> removed;
    /** TRUE if the scope has been committed */
    private boolean committed;
    /** TRUE if the scope has been closed */
    private boolean closed;

    /**
     * Construct a new scope.
     *
     * @param model		model to journal
     * @param parent	enclosing scope, or NULL if none
     */
    protected ModelScope(FluxModel model, ModelScope parent) {
        this.model = model;
        this.parent = parent;
        this.boundMap = new LinkedHashMap<String, double[]>();
        this.mediaSaved = false;
        this.objectiveSaved = false;
        this.added = new ArrayList<String>();
        this.removed = new ArrayList<ModelReaction>();
        this.committed = false;
        this.closed = false;
    }

    /**
     * Journal the current bounds of a reaction, if they have not been journaled already.
     *
     * @param reaction	reaction about to change
     */
    protected void recordBounds(ModelReaction reaction) {
        this.boundMap.putIfAbsent(reaction.getId(),
                new double[] { reaction.getLowerBound(), reaction.getUpperBound() });
    }

    /**
     * Journal the current media, if it has not been journaled already.
     *
     * @param media		media about to be replaced
     */
    protected void recordMedia(Media media) {
        if (! this.mediaSaved) {
            this.savedMedia = media;
            this.mediaSaved = true;
        }
    }

    /**
     * Journal the current objective, if it has not been journaled already.
     *
     * @param objective		objective about to be replaced
     */
    protected void recordObjective(Objective objective) {
        if (! this.objectiveSaved) {
            this.savedObjective = objective;
            this.objectiveSaved = true;
        }
    }

    /**
     * Journal the addition of a reaction.
     *
     * @param reactionId	ID of the new reaction
     */
    protected void recordAdded(String reactionId) {
        this.added.add(reactionId);
    }

    /**
     * Journal the removal of a reaction.  A reaction added and then removed inside the same scope
     * simply disappears from the journal.
     *
     * @param reaction	reaction removed
     */
    protected void recordRemoved(ModelReaction reaction) {
        if (! this.added.remove(reaction.getId())) {
            // Save the bounds the reaction had when the scope began.
            double[] bounds = this.boundMap.remove(reaction.getId());
            if (bounds != null)
                reaction.storeBounds(bounds[0], bounds[1]);
            this.removed.add(reaction);
        }
    }

    /**
     * Mark this scope committed.  Its changes will survive the close.
     */
    public void commit() {
        this.committed = true;
    }

    /**
     * @return TRUE if this scope has been committed
     */
    public boolean isCommitted() {
        return this.committed;
    }

    /**
     * Restore the model to its state when the scope opened.
     */
    private void rollback() {
        // Remove the added reactions, newest first.
        ListIterator<String> addIter = this.added.listIterator(this.added.size());
        while (addIter.hasPrevious())
            this.model.discardReaction(addIter.previous());
        // Put back the removed reactions.
        ListIterator<ModelReaction> remIter = this.removed.listIterator(this.removed.size());
        while (remIter.hasPrevious())
            this.model.reinstateReaction(remIter.previous());
        // Restore the bounds.
        for (Map.Entry<String, double[]> boundEntry : this.boundMap.entrySet()) {
            double[] bounds = boundEntry.getValue();
            this.model.restoreBounds(boundEntry.getKey(), bounds[0], bounds[1]);
        }
        if (this.mediaSaved)
            this.model.restoreMedia(this.savedMedia);
        if (this.objectiveSaved)
            this.model.restoreObjective(this.savedObjective);
    }

    /**
     * Fold this scope's journal into the enclosing scope, so that a rollback of the enclosing scope
     * also reverts the changes committed here.
     */
    private void mergeIntoParent() {
        for (Map.Entry<String, double[]> boundEntry : this.boundMap.entrySet())
            this.parent.boundMap.putIfAbsent(boundEntry.getKey(), boundEntry.getValue());
        if (this.mediaSaved)
            this.parent.recordMedia(this.savedMedia);
        if (this.objectiveSaved)
            this.parent.recordObjective(this.savedObjective);
        for (ModelReaction reaction : this.removed)
            this.parent.recordRemoved(reaction);
        this.parent.added.addAll(this.added);
    }

    /**
     * Close this scope, reverting its changes unless it was committed.
     *
     * @throws IllegalStateException	if an inner scope is still open
     */
    @Override
    public void close() {
        if (! this.closed) {
            this.model.popScope(this);
            this.closed = true;
            if (! this.committed)
                this.rollback();
            else if (this.parent != null)
                this.mergeIntoParent();
        }
    }

}

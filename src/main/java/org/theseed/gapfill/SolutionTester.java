/**
 *
 */
package org.theseed.gapfill;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.FluxSolution;
import org.theseed.gapfill.model.Media;
import org.theseed.gapfill.model.Objective;

/**
 * This object determines which reactions of an integrated gapfilling solution are actually needed.
 * Each reaction is knocked out in its gapfilled direction and the model is solved for every
 * (target, media, threshold) triple.  A reaction is needed if some triple drops below its
 * threshold.  Unneeded reactions stay knocked out while the rest of the solution is tested, so
 * redundant combinations are screened out.
 *
 * At the end, the unneeded reactions are either restored or, if removal was requested, deleted from
 * the model when both their bounds are zero and they are not protected.  The model's objective and
 * media are restored on every exit path.
 */
public class SolutionTester {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SolutionTester.class);
    /** model being tested */
    private FluxModel model;

    /**
     * This object records the bounds changed by a knockout.
     */
    protected static class Knockout {

        /** original bound in the gapfilled direction */
        private double bound;
        /** original opposing bound, or NaN if it was not changed */
        private double opposing;

        /**
         * Knock out a reaction direction in a model and record the original bounds.  If the opposing
         * bound forces flux in the gapfilled direction, it is zeroed as well.
         *
         * @param model			model containing the reaction
         * @param reaction		gapfilled reaction to knock out
         */
        protected Knockout(FluxModel model, GapfilledReaction reaction) {
            String id = reaction.getReactionId();
            Direction dir = reaction.getDirection();
            this.bound = model.getBound(id, dir);
            double opposingBound = model.getBound(id, dir.reverse());
            if (dir.isForcing(opposingBound)) {
                this.opposing = opposingBound;
                model.setBound(id, dir.reverse(), 0.0);
            } else
                this.opposing = Double.NaN;
            model.setBound(id, dir, 0.0);
        }

        /**
         * Restore the original bounds.
         *
         * @param model			model containing the reaction
         * @param reaction		gapfilled reaction to restore
         */
        protected void restore(FluxModel model, GapfilledReaction reaction) {
            model.setBound(reaction.getReactionId(), reaction.getDirection(), this.bound);
            if (! Double.isNaN(this.opposing))
                model.setBound(reaction.getReactionId(), reaction.getDirection().reverse(), this.opposing);
        }

        /**
         * @return TRUE if this knockout captured the same bounds as another
         *
         * @param other		other knockout to compare
         */
        protected boolean sameAs(Knockout other) {
            return this.bound == other.bound && Double.compare(this.opposing, other.opposing) == 0;
        }

        @Override
        public String toString() {
            return "[" + this.bound + ", " + this.opposing + "]";
        }

    }

    /**
     * Construct a solution tester for a model.
     *
     * @param model		model containing the integrated solution
     */
    public SolutionTester(FluxModel model) {
        this.model = model;
    }

    /**
     * Test a gapfilling solution for unneeded reactions.
     *
     * @param solution			gapfilling solution to test
     * @param targets			list of target reaction IDs
     * @param medias			list of medias, parallel to the targets
     * @param thresholds		list of minimum objective values, parallel to the targets
     * @param removeUnneeded	TRUE to delete unneeded reactions from the model
     * @param doNotRemove		gapfilled reactions that must not be deleted
     *
     * @return the list of unneeded reactions
     */
    public List<GapfilledReaction> testSolution(GapfillSolution solution, List<String> targets, List<Media> medias,
            List<Double> thresholds, boolean removeUnneeded, Collection<GapfilledReaction> doNotRemove) {
        return this.testSolution(solution.toList(), targets, medias, thresholds, removeUnneeded, doNotRemove);
    }

    /**
     * Test a list of integrated gapfilled reactions for unneeded ones.
     *
     * @param solution			list of gapfilled reactions to test
     * @param targets			list of target reaction IDs
     * @param medias			list of medias, parallel to the targets
     * @param thresholds		list of minimum objective values, parallel to the targets
     * @param removeUnneeded	TRUE to delete unneeded reactions from the model
     * @param doNotRemove		gapfilled reactions that must not be deleted
     *
     * @return the list of unneeded reactions
     */
    public List<GapfilledReaction> testSolution(List<GapfilledReaction> solution, List<String> targets, List<Media> medias,
            List<Double> thresholds, boolean removeUnneeded, Collection<GapfilledReaction> doNotRemove) {
        final int n = targets.size();
        if (medias.size() != n || thresholds.size() != n)
            throw new IllegalArgumentException("Target, media and threshold lists must be the same length.");
        if (doNotRemove == null)
            doNotRemove = Collections.emptyList();
        FluxModel.Environment environment = this.model.saveEnvironment();
        List<GapfilledReaction> retVal = new ArrayList<GapfilledReaction>();
        Map<GapfilledReaction, Knockout> knockouts = new LinkedHashMap<GapfilledReaction, Knockout>();
        try {
            // Compute the starting objectives.
            for (int i = 0; i < n; i++) {
                this.applyTriple(targets.get(i), medias.get(i));
                FluxSolution start = this.model.solve();
                log.debug("Starting objective for {}/{} = {}.", medias.get(i).getId(), targets.get(i),
                        start.getObjectiveValue());
            }
            for (GapfilledReaction item : solution) {
                if (! this.model.hasReaction(item.getReactionId()))
                    log.warn("Gapfilled reaction {} is not in model {}.", item.getReactionId(), this.model.getId());
                else if (! knockouts.containsKey(item)) {
                    Knockout knockout = null;
                    boolean needed = false;
                    for (int i = 0; i < n; i++) {
                        // With a single triple, the media and objective are already in place.
                        if (n > 1)
                            this.applyTriple(targets.get(i), medias.get(i));
                        knockout = this.knockOut(item, knockout);
                        FluxSolution result = this.model.solve();
                        double objective = result.getObjectiveValue();
                        if (! result.isOptimal()) {
                            log.info("{}/{}: {} needed because the knockout leads to a {} problem.", medias.get(i).getId(),
                                    targets.get(i), item, result.getStatus());
                            needed = true;
                        } else if (objective < thresholds.get(i)) {
                            log.info("{}/{}: {} needed: {} with min obj {}.", medias.get(i).getId(), targets.get(i),
                                    item, objective, thresholds.get(i));
                            needed = true;
                        }
                    }
                    if (knockout == null) {
                        // No triples to test, so nothing is needed and nothing was knocked out.
                        retVal.add(item);
                    } else if (! needed) {
                        log.info("{} not needed.", item);
                        retVal.add(item);
                        knockouts.put(item, knockout);
                    } else
                        knockout.restore(this.model, item);
                }
            }
        } finally {
            this.model.restoreEnvironment(environment);
        }
        // Unneeded knockouts are settled after the environment is restored.
        if (! removeUnneeded) {
            for (Map.Entry<GapfilledReaction, Knockout> entry : knockouts.entrySet())
                entry.getValue().restore(this.model, entry.getKey());
        } else
            this.removeUnneeded(knockouts, doNotRemove);
        return retVal;
    }

    /**
     * Knock out a gapfilled reaction for a new triple.  If the reaction is still knocked out from an
     * earlier triple, the earlier capture is kept.  Otherwise the bounds are captured again; when the
     * new capture differs from an earlier one, the later values win and a warning is logged.
     *
     * @param item		gapfilled reaction to knock out
     * @param prior		knockout from an earlier triple, or NULL if this is the first
     *
     * @return the knockout describing the bounds to restore
     */
    private Knockout knockOut(GapfilledReaction item, Knockout prior) {
        Knockout retVal;
        String id = item.getReactionId();
        Direction dir = item.getDirection();
        boolean stillOut = (prior != null && this.model.getBound(id, dir) == 0.0
                && ! dir.isForcing(this.model.getBound(id, dir.reverse())));
        if (stillOut)
            retVal = prior;
        else {
            retVal = new Knockout(this.model, item);
            if (prior != null && ! retVal.sameAs(prior))
                log.warn("Bounds captured for {} differ between conditions: {} vs {}.  Using the later values.",
                        item, prior, retVal);
        }
        return retVal;
    }

    /**
     * Delete or restore the unneeded reactions.  Protected reaction directions are restored.  Other
     * reactions are deleted if both bounds are zero and no direction of the reaction is protected.
     *
     * @param knockouts		map of unneeded reactions to their knockouts
     * @param doNotRemove	protected reaction directions
     */
    private void removeUnneeded(Map<GapfilledReaction, Knockout> knockouts, Collection<GapfilledReaction> doNotRemove) {
        Set<String> protectedIds = new TreeSet<String>();
        for (GapfilledReaction item : doNotRemove)
            protectedIds.add(item.getReactionId());
        List<String> removals = new ArrayList<String>();
        for (Map.Entry<GapfilledReaction, Knockout> entry : knockouts.entrySet()) {
            GapfilledReaction item = entry.getKey();
            String id = item.getReactionId();
            if (doNotRemove.contains(item))
                entry.getValue().restore(this.model, item);
            else if (this.model.getLowerBound(id) == 0.0 && this.model.getUpperBound(id) == 0.0
                    && ! protectedIds.contains(id))
                removals.add(id);
        }
        if (! removals.isEmpty()) {
            int count = this.model.removeReactions(removals);
            log.info("{} unneeded reactions removed from model {}.", count, this.model.getId());
        }
    }

    /**
     * Apply the media and objective for a test triple.
     *
     * @param target	ID of the target reaction
     * @param media		media to apply
     */
    private void applyTriple(String target, Media media) {
        this.model.setMedia(media);
        this.model.setObjective(Objective.of(target));
    }

    /**
     * @return the model being tested
     */
    public FluxModel getModel() {
        return this.model;
    }

}

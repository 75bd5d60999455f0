/**
 *
 */
package org.theseed.gapfill.reduce;

import java.util.ArrayList;
import java.util.List;

import org.theseed.gapfill.conditions.ConditionTester;
import org.theseed.gapfill.conditions.TestCondition;
import org.theseed.gapfill.model.FluxModel;

/**
 * This expander performs a divide-and-conquer search.  If the condition fails with the whole list
 * present, the second half is blocked and the first half searched; then the second half is
 * restored and searched.  A single failing candidate is blocked and filtered, unless blocking it
 * breaks one of the positive-growth conditions.  In that case it is restored and reported as the
 * breaking reaction, and the whole search aborts.
 *
 * After a positive-growth check, the probed condition is re-applied.  The state active before the
 * check is not saved, so the caller must have applied the probed condition itself.
 */
public class BinaryReactionExpander extends ReactionExpander {

    /**
     * Construct a binary reaction expander.
     *
     * @param tester	condition tester for the model to search
     */
    public BinaryReactionExpander(ConditionTester tester) {
        super(tester);
    }

    @Override
    public ExpansionResult expand(List<CandidateReaction> candidates, TestCondition condition,
            List<TestCondition> positiveGrowth) {
        return this.search(candidates, condition, positiveGrowth, 0);
    }

    /**
     * Search a sublist of the candidates.
     *
     * @param candidates		candidates to search
     * @param condition			condition being probed
     * @param positiveGrowth	conditions that must still pass when a candidate is filtered
     * @param depth				recursion depth
     *
     * @return the result of the search
     */
    private ExpansionResult search(List<CandidateReaction> candidates, TestCondition condition,
            List<TestCondition> positiveGrowth, int depth) {
        ExpansionResult retVal;
        if (candidates.isEmpty() || this.passes(condition))
            retVal = ExpansionResult.empty();
        else if (candidates.size() == 1)
            retVal = this.checkSingle(candidates.get(0), condition, positiveGrowth);
        else {
            FluxModel model = this.getModel();
            int mid = candidates.size() / 2;
            List<CandidateReaction> firstHalf = candidates.subList(0, mid);
            List<CandidateReaction> secondHalf = candidates.subList(mid, candidates.size());
            for (CandidateReaction candidate : secondHalf)
                candidate.zero(model);
            ExpansionResult firstResult = this.search(firstHalf, condition, positiveGrowth, depth + 1);
            List<CandidateReaction> filtered = new ArrayList<CandidateReaction>(firstResult.getFiltered());
            for (CandidateReaction candidate : secondHalf)
                candidate.restore(model);
            if (firstResult.isBroken()) {
                log.debug("Ending early at depth {} due to breaking reaction {}.", depth, firstResult.getBreaking());
                retVal = ExpansionResult.broken(filtered, firstResult.getBreaking());
            } else {
                ExpansionResult secondResult = this.search(secondHalf, condition, positiveGrowth, depth + 1);
                filtered.addAll(secondResult.getFiltered());
                if (secondResult.isBroken())
                    retVal = ExpansionResult.broken(filtered, secondResult.getBreaking());
                else
                    retVal = ExpansionResult.of(filtered);
            }
        }
        return retVal;
    }

    /**
     * Process a single failing candidate.
     *
     * @param candidate			candidate to check
     * @param condition			condition being probed
     * @param positiveGrowth	conditions that must still pass with the candidate blocked
     *
     * @return a result filtering the candidate, or a result naming it as the breaking reaction
     */
    private ExpansionResult checkSingle(CandidateReaction candidate, TestCondition condition,
            List<TestCondition> positiveGrowth) {
        ExpansionResult retVal;
        FluxModel model = this.getModel();
        // The score of the failing test is the one we record.
        double score = this.getLastScore();
        candidate.zero(model);
        boolean success = true;
        if (! positiveGrowth.isEmpty()) {
            ConditionTester tester = this.getTester();
            for (int i = 0; success && i < positiveGrowth.size(); i++) {
                if (! tester.testSingleCondition(positiveGrowth.get(i), true)) {
                    log.debug("{} does not pass positive growth tests.", candidate);
                    success = false;
                }
            }
            tester.applyCondition(condition);
        }
        if (success) {
            candidate.setScore(score);
            List<CandidateReaction> filtered = new ArrayList<CandidateReaction>(1);
            filtered.add(candidate);
            retVal = ExpansionResult.of(filtered);
        } else {
            candidate.restore(model);
            retVal = ExpansionResult.broken(new ArrayList<CandidateReaction>(), candidate);
        }
        return retVal;
    }

}

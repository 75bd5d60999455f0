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
 * This expander blocks all the candidates and then restores them one at a time.  A candidate whose
 * restoration makes the condition fail is blocked again and filtered.  It needs one solve per
 * candidate.
 */
public class LinearReactionExpander extends ReactionExpander {

    /**
     * Construct a linear reaction expander.
     *
     * @param tester	condition tester for the model to search
     */
    public LinearReactionExpander(ConditionTester tester) {
        super(tester);
    }

    @Override
    public ExpansionResult expand(List<CandidateReaction> candidates, TestCondition condition,
            List<TestCondition> positiveGrowth) {
        List<CandidateReaction> filtered = new ArrayList<CandidateReaction>();
        if (! this.passes(condition)) {
            FluxModel model = this.getModel();
            for (CandidateReaction candidate : candidates)
                candidate.zero(model);
            for (CandidateReaction candidate : candidates) {
                candidate.restore(model);
                if (! this.passes(condition)) {
                    candidate.reblock(model);
                    candidate.setScore(this.getLastScore());
                    if (! filtered.contains(candidate))
                        filtered.add(candidate);
                    log.debug("Linear search filtered {}.", candidate);
                }
            }
        }
        return ExpansionResult.of(filtered);
    }

}

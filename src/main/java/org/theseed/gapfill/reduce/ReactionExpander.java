/**
 *
 */
package org.theseed.gapfill.reduce;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.conditions.ConditionTester;
import org.theseed.gapfill.conditions.TestCondition;
import org.theseed.gapfill.model.FluxModel;

/**
 * A reaction expander searches a list of candidate reactions for the ones whose presence makes a
 * test condition fail.  Such candidates are filtered:  they are left blocked in the model and
 * returned in the result.  Every other candidate is left with its bound intact.
 *
 * The condition must already be applied to the model when the search starts.
 */
public abstract class ReactionExpander {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionExpander.class);
    /** condition tester for the model being searched */
    private ConditionTester tester;

    /**
     * This enumeration indicates the types of search.
     */
    public static enum Type {
        /** restore the candidates one at a time */
        LINEAR {
            @Override
            public ReactionExpander create(ConditionTester tester) {
                return new LinearReactionExpander(tester);
            }
        },
        /** divide the candidates in half recursively */
        BINARY {
            @Override
            public ReactionExpander create(ConditionTester tester) {
                return new BinaryReactionExpander(tester);
            }
        };

        /**
         * @return a reaction expander of this type
         *
         * @param tester	condition tester for the model to search
         */
        public abstract ReactionExpander create(ConditionTester tester);
    }

    /**
     * Construct a reaction expander.
     *
     * @param tester	condition tester for the model to search
     */
    public ReactionExpander(ConditionTester tester) {
        this.tester = tester;
    }

    /**
     * Search a candidate list for reactions to filter.
     *
     * @param candidates		list of candidates to search; all must be active in the model
     * @param condition			condition to test (already applied)
     * @param positiveGrowth	conditions a filtered reaction's removal must still pass, possibly empty
     *
     * @return the result of the search
     */
    public abstract ExpansionResult expand(List<CandidateReaction> candidates, TestCondition condition,
            List<TestCondition> positiveGrowth);

    /**
     * @return TRUE if the condition passes in the current model state
     *
     * @param condition		condition to test (already applied)
     */
    protected boolean passes(TestCondition condition) {
        return this.tester.testSingleCondition(condition, false);
    }

    /**
     * @return the score from the last test
     */
    protected double getLastScore() {
        return this.tester.getScore();
    }

    /**
     * @return the condition tester
     */
    protected ConditionTester getTester() {
        return this.tester;
    }

    /**
     * @return the model being searched
     */
    protected FluxModel getModel() {
        return this.tester.getModel();
    }

}

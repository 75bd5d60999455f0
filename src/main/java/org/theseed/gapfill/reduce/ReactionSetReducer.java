/**
 *
 */
package org.theseed.gapfill.reduce;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.conditions.ConditionTester;
import org.theseed.gapfill.conditions.TestCondition;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.ModelScope;

/**
 * The reaction set reducer drives the expansion searches for a list of conditions.  For each
 * condition it verifies that a solution exists, runs the search, and leaves the filtered
 * candidates blocked in the model.  Filtered results accumulate across conditions and are
 * remembered in a {@link FilterCache}, so later runs with the same condition skip them.
 *
 * If some condition cannot pass even with every remaining candidate blocked, the result is
 * {@link ExpansionResult#NO_SOLUTION} and every bound change made by the call is rolled back.
 */
public class ReactionSetReducer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionSetReducer.class);
    /** model being reduced */
    private FluxModel model;
    /** condition tester for the model */
    private ConditionTester tester;
    /** cache of filtered reactions */
    private FilterCache filterCache;
    /** reliability scorer for ordering the search */
    private ReliabilityScorer scorer;

    /**
     * Construct a reaction set reducer for a model with an empty filter cache.
     *
     * @param model		model to reduce
     */
    public ReactionSetReducer(FluxModel model) {
        this(new ConditionTester(model), new FilterCache());
    }

    /**
     * Construct a reaction set reducer.
     *
     * @param tester		condition tester for the model to reduce
     * @param filterCache	cache of previously-filtered reactions
     */
    public ReactionSetReducer(ConditionTester tester, FilterCache filterCache) {
        this.tester = tester;
        this.model = tester.getModel();
        this.filterCache = filterCache;
        this.scorer = new ReliabilityScorer();
    }

    /**
     * Determine whether a condition can pass with all the specified candidates blocked.  The model
     * is restored before returning.
     *
     * @param candidates	candidates to block
     * @param condition		condition to test
     *
     * @return TRUE if the condition passes without the candidates
     */
    public boolean checkIfSolutionExists(List<CandidateReaction> candidates, TestCondition condition) {
        boolean retVal;
        try (ModelScope scope = this.model.openScope()) {
            for (CandidateReaction candidate : candidates)
                candidate.zero(this.model);
            retVal = this.tester.testSingleCondition(condition, true);
        }
        return retVal;
    }

    /**
     * Filter a list of candidate reactions against a list of conditions.  On success the filtered
     * candidates are left blocked in the model and every other candidate keeps its bound.
     *
     * @param reactions				candidate reactions to search; all should be active in the model
     * @param conditions			conditions to test, in order
     * @param binarySearch			TRUE for a binary search, FALSE for a linear one
     * @param positiveGrowth		conditions that must still pass when a candidate is filtered, or NULL
     * @param resortByScore			TRUE to sort the candidates by reliability first
     * @param activeReactionSets	reaction sets from prior solutions, for the reliability scores, or NULL
     *
     * @return the filtered candidates, or {@link ExpansionResult#NO_SOLUTION} if some condition cannot pass
     */
    public ExpansionResult reactionExpansionTest(List<CandidateReaction> reactions, List<TestCondition> conditions,
            boolean binarySearch, List<TestCondition> positiveGrowth, boolean resortByScore,
            Collection<? extends Collection<CandidateReaction>> activeReactionSets) {
        log.debug("Expansion started with {} candidates.  Binary = {}.", reactions.size(), binarySearch);
        if (positiveGrowth == null)
            positiveGrowth = Collections.emptyList();
        if (activeReactionSets == null)
            activeReactionSets = Collections.emptyList();
        // Each reaction direction can only appear once.
        List<CandidateReaction> searchList = new ArrayList<CandidateReaction>(new LinkedHashSet<CandidateReaction>(reactions));
        if (searchList.size() < reactions.size())
            log.warn("{} duplicate candidates removed from the reaction set.", reactions.size() - searchList.size());
        if (resortByScore)
            this.scorer.sortCandidates(searchList, activeReactionSets);
        ReactionExpander expander = (binarySearch ? ReactionExpander.Type.BINARY : ReactionExpander.Type.LINEAR)
                .create(this.tester);
        List<CandidateReaction> filteredList = new ArrayList<CandidateReaction>();
        ExpansionResult retVal = null;
        try (ModelScope outer = this.model.openScope()) {
            for (int i = 0; retVal == null && i < conditions.size(); i++) {
                TestCondition condition = conditions.get(i);
                log.debug("Testing condition {}.", condition);
                long start = System.currentTimeMillis();
                List<CandidateReaction> remaining = this.applyCache(searchList, filteredList, condition);
                if (! this.checkIfSolutionExists(remaining, condition)) {
                    log.debug("No solution exists that passes tests for condition {}.", condition);
                    retVal = ExpansionResult.NO_SOLUTION;
                } else {
                    List<CandidateReaction> newFiltered = new ArrayList<CandidateReaction>();
                    boolean ok = this.runSearch(expander, remaining, condition, positiveGrowth, newFiltered);
                    if (! ok)
                        retVal = ExpansionResult.NO_SOLUTION;
                    else {
                        // The search scope is gone, so block the new filtered reactions again.
                        for (CandidateReaction candidate : newFiltered) {
                            candidate.reblock(this.model);
                            this.filterCache.record(condition, candidate);
                        }
                        filteredList.addAll(newFiltered);
                        log.info("Expansion time for {}: {} ms.", condition.getMedia(), System.currentTimeMillis() - start);
                        log.info("Filtered count: {} out of {}.", filteredList.size(), searchList.size());
                    }
                }
            }
            if (retVal == null) {
                outer.commit();
                retVal = ExpansionResult.of(filteredList);
            }
        }
        return retVal;
    }

    /**
     * Block the candidates already filtered for a condition by a previous run, and return the ones
     * still to be searched.
     *
     * @param searchList	full list of candidates
     * @param filteredList	list of candidates filtered so far, updated by this method
     * @param condition		condition about to be tested
     *
     * @return the list of candidates to search
     */
    private List<CandidateReaction> applyCache(List<CandidateReaction> searchList, List<CandidateReaction> filteredList,
            TestCondition condition) {
        List<CandidateReaction> retVal = new ArrayList<CandidateReaction>(searchList.size());
        Map<String, Map<Direction, FilterCache.FilterRecord>> cached = this.filterCache.getFiltered(condition);
        int count = 0;
        for (CandidateReaction candidate : searchList) {
            // Candidates filtered for an earlier condition are already blocked.
            if (! filteredList.contains(candidate)) {
                Map<Direction, FilterCache.FilterRecord> dirMap = cached.get(candidate.getReactionId());
                if (dirMap != null && dirMap.containsKey(candidate.getDirection())) {
                    candidate.zero(this.model);
                    candidate.setScore(dirMap.get(candidate.getDirection()).getScore());
                    filteredList.add(candidate);
                    count++;
                } else
                    retVal.add(candidate);
            }
        }
        if (count > 0)
            log.info("{} candidates filtered from the cache for {}.", count, condition);
        return retVal;
    }

    /**
     * Run the expansion search for a single condition.  Each breaking reaction is removed from the
     * search and kept as mandatory, and the search restarts on the candidates not yet filtered.
     * The model is restored before returning, so the filtered candidates must be blocked again by
     * the caller.
     *
     * @param expander			search strategy
     * @param remaining			list of candidates to search; breaking reactions are removed from it
     * @param condition			condition to test
     * @param positiveGrowth	conditions that must still pass when a candidate is filtered
     * @param newFiltered		list to receive the filtered candidates
     *
     * @return TRUE if the search completed, FALSE if no solution exists after keeping a breaking reaction
     */
    private boolean runSearch(ReactionExpander expander, List<CandidateReaction> remaining, TestCondition condition,
            List<TestCondition> positiveGrowth, List<CandidateReaction> newFiltered) {
        boolean retVal = true;
        try (ModelScope probe = this.model.openScope()) {
            this.tester.applyCondition(condition);
            boolean done = false;
            while (! done) {
                ExpansionResult result = expander.expand(remaining, condition, positiveGrowth);
                for (CandidateReaction candidate : result.getFiltered()) {
                    if (! newFiltered.contains(candidate))
                        newFiltered.add(candidate);
                }
                if (! result.isBroken())
                    done = true;
                else {
                    CandidateReaction breaking = result.getBreaking();
                    log.debug("Keeping breaking reaction {}.", breaking);
                    remaining.remove(breaking);
                    remaining.removeAll(newFiltered);
                    if (! this.checkIfSolutionExists(remaining, condition)) {
                        log.debug("No solution exists after retaining breaking reaction {}.", breaking);
                        retVal = false;
                        done = true;
                    }
                }
            }
        }
        return retVal;
    }

    /**
     * @return the filter cache
     */
    public FilterCache getFilterCache() {
        return this.filterCache;
    }

    /**
     * @return the reliability scorer
     */
    public ReliabilityScorer getScorer() {
        return this.scorer;
    }

    /**
     * Specify a new reliability scorer.
     *
     * @param scorer 	the scorer to use
     */
    public void setScorer(ReliabilityScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * @return the condition tester
     */
    public ConditionTester getTester() {
        return this.tester;
    }

}

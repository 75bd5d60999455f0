/**
 *
 */
package org.theseed.gapfill;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.conditions.ConditionTester;
import org.theseed.gapfill.conditions.TestCondition;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.FluxSolution;
import org.theseed.gapfill.model.Media;
import org.theseed.gapfill.model.ModelReaction;
import org.theseed.gapfill.model.ModelScope;
import org.theseed.gapfill.model.Objective;
import org.theseed.gapfill.reduce.CandidateReaction;
import org.theseed.gapfill.reduce.ExpansionResult;
import org.theseed.gapfill.reduce.FilterCache;
import org.theseed.gapfill.reduce.ReactionSetReducer;
import org.theseed.gapfill.reduce.ReliabilityScorer;

/**
 * This object gapfills a model in one or more medias.  The gapfilling problem itself is built and
 * solved by a {@link GapfillingPackage}; this object tests the gapfilling database, prefilters it
 * against the test conditions, runs the gapfilling, and integrates the solutions into the live model.
 *
 * When several medias are gapfilled in one run, the solutions are integrated according to an
 * {@link IntegrationPolicy}.  Independent gapfilling treats each media in isolation.  Sequential
 * gapfilling lets each media reuse the reactions already added for the earlier ones.  Global
 * gapfilling solves a single merged problem for all the medias at once.  In every case a final
 * need test removes reactions that no media requires.
 */
public class MultiMediaGapfiller {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MultiMediaGapfiller.class);
    /** live model being gapfilled */
    private FluxModel model;
    /** gapfilling problem builder */
    private GapfillingPackage gfPackage;
    /** conditions the gapfilling database must not violate */
    private List<TestCondition> testConditions;
    /** map of core reaction IDs to gene IDs to probabilities */
    private Map<String, Map<String, Double>> reactionScores;
    /** filter cache and sensitivity report for the model */
    private ModelAttributes attributes;
    /** solutions integrated into the model */
    private List<GapfillSolution> integratedGapfillings;
    /** all reactions retained by integration */
    private List<GapfilledReaction> cumulativeGapfilling;
    /** reliability scorer for ordering the prefilter search */
    private ReliabilityScorer scorer;
    /** map of metabolite IDs to charges, or NULL if charges are unknown */
    private Map<String, Double> metaboliteCharges;
    /** biomass sensitivity analyzer */
    private SensitivityAnalyzer analyzer;
    /** TRUE to use a binary search when prefiltering */
    private boolean binarySearch;
    /** default target reaction */
    private String defaultTarget;
    /** default minimum objective */
    private double defaultMinObjective;
    /** last gapfilling solution computed */
    private GapfillSolution lastSolution;
    /** bound used to open a gapfilled reaction direction */
    public static final double GAPFILL_BOUND = 100.0;
    /** note key for genes assigned during integration */
    public static final String NEW_GENES_NOTE = "new_genes";
    /** minimum flux considered nonzero */
    private static final double EPSILON = 1e-8;

    /**
     * This object contains the medias that survived the gapfilling database test, with their targets,
     * thresholds, growth conditions and active reaction sets.
     */
    public static class ConditionSet {

        /** surviving medias */
        private List<Media> medias;
        /** target for each media */
        private List<String> targets;
        /** threshold for each media */
        private List<Double> thresholds;
        /** growth condition for each media */
        private List<TestCondition> conditions;
        /** candidate reactions active in each database test */
        private List<List<CandidateReaction>> activeReactions;

        protected ConditionSet() {
            this.medias = new ArrayList<Media>();
            this.targets = new ArrayList<String>();
            this.thresholds = new ArrayList<Double>();
            this.conditions = new ArrayList<TestCondition>();
            this.activeReactions = new ArrayList<List<CandidateReaction>>();
        }

        /**
         * Add a surviving media.
         *
         * @param media			media to add
         * @param target		target reaction ID
         * @param threshold		minimum objective
         * @param active		candidate reactions active in the database test
         */
        protected void add(Media media, String target, double threshold, List<CandidateReaction> active) {
            this.medias.add(media);
            this.targets.add(target);
            this.thresholds.add(threshold);
            this.conditions.add(TestCondition.growth(media, target, threshold));
            this.activeReactions.add(active);
        }

        /**
         * @return the number of surviving medias
         */
        public int size() {
            return this.medias.size();
        }

        /**
         * @return TRUE if no media survived
         */
        public boolean isEmpty() {
            return this.medias.isEmpty();
        }

        /**
         * @return the surviving medias
         */
        public List<Media> getMedias() {
            return this.medias;
        }

        /**
         * @return the target for each surviving media
         */
        public List<String> getTargets() {
            return this.targets;
        }

        /**
         * @return the threshold for each surviving media
         */
        public List<Double> getThresholds() {
            return this.thresholds;
        }

        /**
         * @return the growth condition for each surviving media
         */
        public List<TestCondition> getConditions() {
            return this.conditions;
        }

        /**
         * @return the active candidate reactions for each surviving media
         */
        public List<List<CandidateReaction>> getActiveReactions() {
            return this.activeReactions;
        }

    }

    /**
     * Construct a gapfiller for a model.
     *
     * @param model			live model to gapfill
     * @param gfPackage		gapfilling problem builder for the model
     */
    public MultiMediaGapfiller(FluxModel model, GapfillingPackage gfPackage) {
        this.model = model;
        this.gfPackage = gfPackage;
        this.testConditions = new ArrayList<TestCondition>();
        this.reactionScores = new HashMap<String, Map<String, Double>>();
        this.attributes = new ModelAttributes();
        this.integratedGapfillings = new ArrayList<GapfillSolution>();
        this.cumulativeGapfilling = new ArrayList<GapfilledReaction>();
        this.scorer = new ReliabilityScorer();
        this.metaboliteCharges = null;
        this.analyzer = new SensitivityAnalyzer();
        this.binarySearch = true;
        this.defaultTarget = "bio1";
        this.defaultMinObjective = 0.01;
        this.lastSolution = null;
    }

    /**
     * Test whether the gapfilling database can activate a target in a media.  If it cannot, and the
     * test problem itself was feasible, the unproducible biomass compounds are recorded in the
     * sensitivity report.
     *
     * @param media				media to test
     * @param target			target reaction ID, or NULL to use the default
     * @param beforeFiltering	TRUE if the database has not been prefiltered yet
     * @param activeReactions	list to receive the candidate reactions active in the test
     *
     * @return TRUE if the database can activate the target
     */
    public boolean testGapfillDatabase(Media media, String target, boolean beforeFiltering,
            List<CandidateReaction> activeReactions) {
        if (target != null)
            this.gfPackage.setBaseObjective(target, Double.NaN);
        else
            target = this.defaultTarget;
        this.gfPackage.setMedia(media);
        boolean retVal = this.gfPackage.testGapfillDatabase(activeReactions);
        if (! retVal && ! this.gfPackage.isTestInfeasible()) {
            List<String> compounds = this.analyzer.findUnproducibleBiomassCompounds(this.gfPackage.getModel(), target);
            this.attributes.getSensitivity().recordDatabaseFailure(media.getId(), target, beforeFiltering, compounds);
            log.warn("No gapfilling solution found {} filtering for {} activating {}.",
                    (beforeFiltering ? "before" : "after"), media.getId(), target);
        }
        return retVal;
    }

    /**
     * Test the gapfilling database for each media, and keep only the medias that pass.  If requested,
     * the database is then prefiltered and the surviving medias are tested again.
     *
     * @param medias		list of medias
     * @param targets		list of target reaction IDs, parallel to the medias
     * @param thresholds	list of minimum objectives, parallel to the medias
     * @param prefilter		TRUE to prefilter the database
     *
     * @return the surviving medias with their targets and thresholds
     */
    public ConditionSet testAndAdjustGapfillingConditions(List<Media> medias, List<String> targets,
            List<Double> thresholds, boolean prefilter) {
        if (targets.size() != medias.size() || thresholds.size() != medias.size())
            throw new IllegalArgumentException("Media, target and threshold lists must be the same length.");
        log.debug("Testing unfiltered database.");
        ConditionSet retVal = new ConditionSet();
        for (int i = 0; i < medias.size(); i++) {
            List<CandidateReaction> active = new ArrayList<CandidateReaction>();
            if (this.testGapfillDatabase(medias.get(i), targets.get(i), true, active))
                retVal.add(medias.get(i), targets.get(i), thresholds.get(i), active);
        }
        if (prefilter && ! retVal.isEmpty()) {
            log.debug("Filtering database.");
            ConditionSet filtered = new ConditionSet();
            if (! this.prefilter(null, retVal.getConditions(), false, retVal.getActiveReactions()))
                log.warn("Prefiltering failed:  no medias can be gapfilled.");
            else {
                log.debug("Testing filtered database.");
                for (int i = 0; i < retVal.size(); i++) {
                    List<CandidateReaction> active = new ArrayList<CandidateReaction>();
                    Media media = retVal.getMedias().get(i);
                    String target = retVal.getTargets().get(i);
                    if (this.testGapfillDatabase(media, target, false, active))
                        filtered.add(media, target, retVal.getThresholds().get(i), active);
                }
            }
            retVal = filtered;
        }
        log.info("{} of {} medias can be gapfilled.", retVal.size(), medias.size());
        return retVal;
    }

    /**
     * Filter the gapfilling database by blocking every candidate reaction that breaks a test condition.
     * The growth conditions must still pass after each reaction is blocked.
     *
     * @param conditions			test conditions, or NULL to use the configured ones
     * @param growthConditions		conditions that must keep passing
     * @param usePriorFiltering		TRUE to start from the filter results already recorded for the model
     * @param activeReactionSets	candidate reactions active in prior database tests, for ordering, or NULL
     *
     * @return FALSE if no filtering could satisfy the test conditions, else TRUE
     */
    public boolean prefilter(List<TestCondition> conditions, List<TestCondition> growthConditions,
            boolean usePriorFiltering, Collection<? extends Collection<CandidateReaction>> activeReactionSets) {
        if (conditions == null)
            conditions = this.testConditions;
        boolean retVal = true;
        if (conditions.isEmpty())
            log.debug("No test conditions:  prefiltering skipped.");
        else {
            log.debug("Prefiltering with {} growth conditions.", (growthConditions == null ? 0 : growthConditions.size()));
            FilterCache cache = new FilterCache();
            if (usePriorFiltering)
                cache.merge(this.attributes.getFilterCache());
            FluxModel gfModel = this.gfPackage.getModel();
            ReactionSetReducer reducer = new ReactionSetReducer(new ConditionTester(gfModel), cache);
            if (this.metaboliteCharges != null)
                this.scorer.computeTransportedCharges(gfModel.getReactions(), this.metaboliteCharges);
            reducer.setScorer(this.scorer);
            List<CandidateReaction> candidates = this.gfPackage.getCandidateReactions();
            ExpansionResult result = reducer.reactionExpansionTest(candidates, conditions, this.binarySearch,
                    growthConditions, true, activeReactionSets);
            this.attributes.getFilterCache().merge(cache);
            if (result.isNoSolution()) {
                log.warn("No filtering of the gapfilling database satisfies the test conditions.");
                retVal = false;
            } else
                log.info("{} of {} gapfilling candidates filtered.", result.getFiltered().size(), candidates.size());
        }
        return retVal;
    }

    /**
     * Gapfill the model for a single media.
     *
     * @param media				media to gapfill
     * @param target			target reaction ID, or NULL to use the default
     * @param minObjective		minimum objective, or NaN to use the default
     * @param binaryCheck		TRUE to reduce the solution to a minimal one
     * @param prefilter			TRUE to prefilter the database first
     *
     * @return the gapfilling solution, or NULL if none was found
     */
    public GapfillSolution runGapfilling(Media media, String target, double minObjective, boolean binaryCheck,
            boolean prefilter) {
        if (target == null)
            target = this.defaultTarget;
        if (Double.isNaN(minObjective))
            minObjective = this.defaultMinObjective;
        GapfillSolution retVal = null;
        if (this.testGapfillDatabase(media, target, prefilter, new ArrayList<CandidateReaction>())) {
            boolean ok = true;
            if (prefilter) {
                ok = this.prefilter(null, Collections.singletonList(TestCondition.growth(media, target, minObjective)),
                        false, null);
                if (! ok)
                    log.warn("Prefiltering failed for {}:  no gapfilling attempted.", media.getId());
                else
                    ok = this.testGapfillDatabase(media, target, false, new ArrayList<CandidateReaction>());
            }
            if (ok) {
                // The database test leaves the target unconstrained, so restore the real objective.
                this.gfPackage.setBaseObjective(target, minObjective);
                this.gfPackage.setMedia(media);
                FluxSolution solution = this.gfPackage.solve();
                log.debug("Gapfill solution objective value {} ({}) for media {}.", solution.getObjectiveValue(),
                        solution.getStatus(), media.getId());
                if (! solution.isOptimal())
                    log.warn("No solution found for {}.", media.getId());
                else {
                    GapfillSolution raw = this.gfPackage.computeGapfilledSolution(null);
                    if (binaryCheck)
                        raw = this.gfPackage.binaryCheckGapfillingSolution(raw);
                    retVal = raw.forCondition(media, target, minObjective, binaryCheck);
                    this.lastSolution = retVal;
                }
            }
        }
        return retVal;
    }

    /**
     * Gapfill the model for several medias with a single merged problem.  The merged problem shares one
     * max-flux variable per candidate reaction direction across the medias, and minimizes the total
     * penalty of the variables used.
     *
     * @param medias		list of medias
     * @param targets		list of target reaction IDs, parallel to the medias
     * @param thresholds	list of minimum objectives, parallel to the medias
     * @param binaryCheck	TRUE if the solution should be marked as binary-checked
     * @param prefilter		TRUE to prefilter the database first
     *
     * @return the global solution, or NULL if none was found
     */
    public GapfillSolution runGlobalGapfilling(List<Media> medias, List<String> targets, List<Double> thresholds,
            boolean binaryCheck, boolean prefilter) {
        long start = System.currentTimeMillis();
        GapfillSolution retVal = null;
        ConditionSet conditions = this.testAndAdjustGapfillingConditions(medias, targets, thresholds, prefilter);
        if (conditions.isEmpty())
            log.warn("No medias can be gapfilled in global mode.");
        else {
            this.gfPackage.createMaxFluxVariables();
            MergedGapfillProblem merged = this.gfPackage.mergeProblems(conditions.getMedias(), conditions.getTargets(),
                    conditions.getThresholds());
            Map<String, Map<Direction, Double>> penalties = this.gfPackage.getGapfillingPenalties();
            Map<CandidateReaction, Double> coefficients = new LinkedHashMap<CandidateReaction, Double>();
            for (CandidateReaction key : merged.getMaxFluxKeys()) {
                double coeff = 1.0;
                Map<Direction, Double> dirMap = penalties.get(key.getReactionId());
                if (dirMap != null && dirMap.containsKey(key.getDirection()))
                    coeff = Math.abs(dirMap.get(key.getDirection()));
                coefficients.put(key, coeff);
            }
            merged.setObjective(coefficients);
            log.info("Starting global optimization with {} max-flux variables for {} medias.", coefficients.size(),
                    conditions.size());
            FluxSolution solution = merged.solve();
            log.info("Global gapfill solution objective value {} ({}) after {} ms.", solution.getObjectiveValue(),
                    solution.getStatus(), System.currentTimeMillis() - start);
            if (! solution.isOptimal())
                log.warn("No global gapfilling solution found.");
            else {
                Map<String, Map<Direction, Double>> fluxValues = new HashMap<String, Map<Direction, Double>>();
                for (CandidateReaction key : coefficients.keySet()) {
                    double primal = merged.getPrimal(key);
                    if (primal > EPSILON)
                        log.debug("{} {} penalty {}.", key, primal, coefficients.get(key));
                    fluxValues.computeIfAbsent(key.getReactionId(), x -> new HashMap<Direction, Double>())
                            .put(key.getDirection(), primal);
                }
                GapfillSolution raw = this.gfPackage.computeGapfilledSolution(fluxValues);
                retVal = raw.forCondition(conditions.getMedias().get(0), conditions.getTargets().get(0),
                        conditions.getThresholds().get(0), false);
                this.lastSolution = retVal;
                log.info("Global solution: {}.", retVal);
            }
        }
        return retVal;
    }

    /**
     * Integrate a gapfilling solution into the live model.  New reactions are copied from the gapfilling
     * model, and each gapfilled direction is opened.  The need tester then determines which reactions
     * are actually needed for the solution's condition.
     *
     * @param solution			solution to integrate
     * @param cumulative		cumulative list of retained reactions, updated by this method
     * @param removeUnneeded	TRUE to delete unneeded reactions from the model
     * @param checkForGrowth	TRUE to measure the objective after integration
     * @param policy			integration policy in effect
     *
     * @return the integrated solution, containing only the needed reactions
     */
    public GapfillSolution integrateGapfillSolution(GapfillSolution solution, List<GapfilledReaction> cumulative,
            boolean removeUnneeded, boolean checkForGrowth, IntegrationPolicy policy) {
        log.debug("Initial solution: {}.", solution);
        FluxModel.Environment environment = this.model.saveEnvironment();
        Media media = solution.getMedia();
        String target = solution.getTarget();
        GapfillSolution retVal = new GapfillSolution(media, target, solution.getMinObjective(), solution.isBinaryCheck());
        // In independent mode, the earlier solutions are hidden while this one is tested.
        Map<GapfilledReaction, Double> suppressed = new LinkedHashMap<GapfilledReaction, Double>();
        try {
            this.model.setObjective(Objective.of(target));
            if (policy == IntegrationPolicy.INDEPENDENT) {
                for (GapfilledReaction item : cumulative) {
                    if (this.model.hasReaction(item.getReactionId()))
                        suppressed.put(item, this.model.zeroBound(item.getReactionId(), item.getDirection()));
                }
            }
            List<GapfilledReaction> listSolution = new ArrayList<GapfilledReaction>();
            List<GapfilledReaction> newCumulative = new ArrayList<GapfilledReaction>();
            for (GapfilledReaction item : solution.toList()) {
                if (this.integrateReaction(item)) {
                    listSolution.add(item);
                    if (! cumulative.contains(item) && ! newCumulative.contains(item))
                        newCumulative.add(item);
                }
            }
            SolutionTester tester = new SolutionTester(this.model);
            List<String> targets = Collections.singletonList(target);
            List<Media> medias = Collections.singletonList(media);
            List<Double> thresholds = Collections.singletonList(solution.getMinObjective());
            List<GapfilledReaction> unneeded;
            if (policy == IntegrationPolicy.INDEPENDENT) {
                unneeded = tester.testSolution(listSolution, targets, medias, thresholds, removeUnneeded, cumulative);
                for (GapfilledReaction item : listSolution) {
                    if (! unneeded.contains(item)) {
                        retVal.add(item);
                        if (! cumulative.contains(item))
                            cumulative.add(item);
                    }
                }
                this.restoreSuppressed(suppressed);
            } else {
                List<GapfilledReaction> fullSolution = new ArrayList<GapfilledReaction>(cumulative);
                fullSolution.addAll(newCumulative);
                log.debug("Full solution: {}.", fullSolution);
                unneeded = tester.testSolution(fullSolution, targets, medias, thresholds, removeUnneeded, cumulative);
                for (GapfilledReaction item : cumulative) {
                    if (! unneeded.contains(item))
                        retVal.add(item);
                }
                for (GapfilledReaction item : newCumulative) {
                    if (! unneeded.contains(item)) {
                        retVal.add(item);
                        cumulative.add(item);
                    }
                }
            }
            log.debug("Unneeded: {}.", unneeded);
            log.info("Integrated solution for {}: {} reactions, {} cumulative.", media.getId(), retVal.gapfillCount(),
                    cumulative.size());
            if (checkForGrowth) {
                this.model.setMedia(media);
                double growth = this.model.solve().getObjectiveOrZero();
                retVal.setGrowth(growth);
                log.info("Growth: {} {}.", growth, media.getId());
            }
            this.integratedGapfillings.add(retVal);
            for (GapfilledReaction item : cumulative) {
                if (! this.cumulativeGapfilling.contains(item))
                    this.cumulativeGapfilling.add(item);
            }
        } finally {
            this.restoreSuppressed(suppressed);
            this.model.restoreEnvironment(environment);
        }
        return retVal;
    }

    /**
     * Reopen the cumulative reactions hidden during an independent integration.  Each entry is
     * removed from the map as it is restored.
     *
     * @param suppressed	map of hidden reactions to their original bounds
     */
    private void restoreSuppressed(Map<GapfilledReaction, Double> suppressed) {
        Iterator<Map.Entry<GapfilledReaction, Double>> iter = suppressed.entrySet().iterator();
        while (iter.hasNext()) {
            Map.Entry<GapfilledReaction, Double> entry = iter.next();
            GapfilledReaction item = entry.getKey();
            if (this.model.hasReaction(item.getReactionId()))
                this.model.setBound(item.getReactionId(), item.getDirection(), entry.getValue());
            iter.remove();
        }
    }

    /**
     * Add a gapfilled reaction direction to the live model.  A reaction not yet in the model is copied
     * from the gapfilling model with both bounds closed.  The gapfilled direction is then opened.
     *
     * @param item		gapfilled reaction to integrate
     *
     * @return TRUE if the reaction was integrated, FALSE if it could not be found
     */
    private boolean integrateReaction(GapfilledReaction item) {
        boolean retVal = true;
        String id = item.getReactionId();
        if (! this.model.hasReaction(id)) {
            ModelReaction source = this.gfPackage.getModel().getReaction(id);
            if (source == null) {
                log.warn("Gapfilled reaction {} not found in the gapfilling model.", id);
                retVal = false;
            } else {
                log.debug("Adding reaction {}.", id);
                this.model.addReaction(source.copy());
                this.model.setBounds(id, 0.0, 0.0);
            }
        }
        if (retVal) {
            log.info("Integrating reaction {}.", item);
            ModelReaction rxn = this.model.getReaction(id);
            if (! rxn.hasGenes())
                this.assignGene(rxn);
            Direction dir = item.getDirection();
            this.model.setBound(id, dir, (dir == Direction.FORWARD ? GAPFILL_BOUND : -GAPFILL_BOUND));
        }
        return retVal;
    }

    /**
     * Assign the most probable gene to a reaction with no genes, using the reaction scores.  The
     * compartment suffix is stripped from the reaction ID to find the scores.
     *
     * @param rxn		reaction to update
     */
    protected void assignGene(ModelReaction rxn) {
        String coreId = rxn.getId().replaceAll("_[a-z]\\d+$", "");
        Map<String, Double> geneScores = this.reactionScores.get(coreId);
        if (geneScores != null && ! geneScores.isEmpty()) {
            log.debug("Found reaction scores for core ID {}.", coreId);
            String bestGene = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (Map.Entry<String, Double> entry : geneScores.entrySet()) {
                if (bestGene == null || entry.getValue() > bestScore) {
                    bestGene = entry.getKey();
                    bestScore = entry.getValue();
                }
            }
            log.info("Assigning gene {} to reaction {}.", bestGene, rxn.getId());
            rxn.setGeneRule(bestGene);
            rxn.setNote(NEW_GENES_NOTE, bestGene);
        }
    }

    /**
     * Gapfill the model for a list of medias using the integration policy in the parameters.
     *
     * @param medias				list of medias to gapfill
     * @param parms					tuning parameters
     * @param targetsByMedia		map of medias to target reaction IDs, or NULL to always use the default target
     * @param minimumObjectives		map of medias to minimum objectives, or NULL to always use the default
     *
     * @return the result of the run, or NULL if no media could be gapfilled
     */
    public MultiGapfillResult runMultiGapfill(List<Media> medias, GapfillParms parms, Map<Media, String> targetsByMedia,
            Map<Media, Double> minimumObjectives) {
        if (targetsByMedia == null)
            targetsByMedia = Collections.emptyMap();
        if (minimumObjectives == null)
            minimumObjectives = Collections.emptyMap();
        IntegrationPolicy policy = parms.getMode();
        FluxModel liveModel = this.model;
        List<GapfillSolution> liveGapfillings = this.integratedGapfillings;
        List<GapfilledReaction> liveCumulative = this.cumulativeGapfilling;
        if (! parms.isIntegrate()) {
            log.info("Gapfilling a copy of model {}.", liveModel.getId());
            this.model = liveModel.copy();
            this.integratedGapfillings = new ArrayList<GapfillSolution>();
            this.cumulativeGapfilling = new ArrayList<GapfilledReaction>(liveCumulative);
        }
        this.binarySearch = parms.isBinarySearch();
        MultiGapfillResult retVal = null;
        try {
            List<String> targets = new ArrayList<String>(medias.size());
            List<Double> thresholds = new ArrayList<Double>(medias.size());
            for (Media media : medias) {
                targets.add(targetsByMedia.getOrDefault(media, parms.getTarget()));
                thresholds.add(minimumObjectives.getOrDefault(media, parms.getMinObjective()));
            }
            ConditionSet conditions = this.testAndAdjustGapfillingConditions(medias, targets, thresholds,
                    parms.isPrefilter());
            if (conditions.isEmpty())
                log.warn("No medias left to gapfill.");
            else {
                log.info("Running {} gapfilling on {} medias.", policy, conditions.size());
                retVal = new MultiGapfillResult(policy);
                for (Media media : medias) {
                    if (! conditions.getMedias().contains(media))
                        retVal.addFailure(media);
                }
                List<GapfilledReaction> cumulative = new ArrayList<GapfilledReaction>();
                boolean ok;
                if (policy == IntegrationPolicy.GLOBAL)
                    ok = this.runGlobalMode(conditions, parms, cumulative, retVal);
                else
                    ok = this.runSeparateMode(conditions, parms, cumulative, retVal);
                if (! ok)
                    retVal = null;
                else {
                    retVal.setCumulative(cumulative);
                    if (parms.isSensitivity())
                        this.runSensitivityAnalysis(retVal);
                }
            }
        } finally {
            this.model = liveModel;
            this.integratedGapfillings = liveGapfillings;
            this.cumulativeGapfilling = liveCumulative;
        }
        return retVal;
    }

    /**
     * Gapfill each media separately, using the independent or sequential policy.
     *
     * @param conditions	surviving medias
     * @param parms			tuning parameters
     * @param cumulative	cumulative list of retained reactions
     * @param result		result object to update
     *
     * @return TRUE if some media was gapfilled
     */
    private boolean runSeparateMode(ConditionSet conditions, GapfillParms parms, List<GapfilledReaction> cumulative,
            MultiGapfillResult result) {
        IntegrationPolicy policy = result.getPolicy();
        List<Media> goodMedias = new ArrayList<Media>();
        List<String> goodTargets = new ArrayList<String>();
        List<Double> goodThresholds = new ArrayList<Double>();
        for (int i = 0; i < conditions.size(); i++) {
            Media media = conditions.getMedias().get(i);
            String target = conditions.getTargets().get(i);
            double threshold = conditions.getThresholds().get(i);
            GapfillSolution solution = this.runGapfilling(media, target, threshold, parms.isBinaryCheck(), false);
            if (solution == null)
                result.addFailure(media);
            else {
                GapfillSolution integrated = this.integrateGapfillSolution(solution, cumulative,
                        parms.isRemoveUnneeded(), parms.isCheckForGrowth(), policy);
                result.addSolution(media, integrated);
                goodMedias.add(media);
                goodTargets.add(target);
                goodThresholds.add(threshold);
                if (policy == IntegrationPolicy.SEQUENTIAL) {
                    // Reactions already integrated should no longer be penalized.
                    this.gfPackage.computeGapfillingPenalties(cumulative);
                    this.gfPackage.buildGapfillingObjectiveFunction();
                }
            }
        }
        if (policy == IntegrationPolicy.SEQUENTIAL) {
            this.gfPackage.computeGapfillingPenalties(null);
            this.gfPackage.buildGapfillingObjectiveFunction();
        } else if (! goodMedias.isEmpty()) {
            SolutionTester tester = new SolutionTester(this.model);
            List<GapfilledReaction> unneeded = tester.testSolution(cumulative, goodTargets, goodMedias, goodThresholds,
                    parms.isRemoveUnneeded(), null);
            this.dropUnneeded(cumulative, unneeded, result);
            log.info("{} reactions unneeded by the joint solution.", unneeded.size());
        }
        return ! goodMedias.isEmpty();
    }

    /**
     * Gapfill all the medias with a single merged problem, integrate the solution for each media, and
     * then remove the reactions no media needs.
     *
     * @param conditions	surviving medias
     * @param parms			tuning parameters
     * @param cumulative	cumulative list of retained reactions
     * @param result		result object to update
     *
     * @return TRUE if the global problem was solved
     */
    private boolean runGlobalMode(ConditionSet conditions, GapfillParms parms, List<GapfilledReaction> cumulative,
            MultiGapfillResult result) {
        boolean retVal = false;
        GapfillSolution full = this.runGlobalGapfilling(conditions.getMedias(), conditions.getTargets(),
                conditions.getThresholds(), parms.isBinaryCheck(), false);
        if (full == null) {
            for (Media media : conditions.getMedias())
                result.addFailure(media);
        } else {
            for (int i = 0; i < conditions.size(); i++) {
                Media media = conditions.getMedias().get(i);
                GapfillSolution copy = full.forCondition(media, conditions.getTargets().get(i),
                        conditions.getThresholds().get(i), parms.isBinaryCheck());
                // Reactions unneeded here may be needed by another media, so nothing is removed yet.
                GapfillSolution integrated = this.integrateGapfillSolution(copy, cumulative, false,
                        parms.isCheckForGrowth(), IntegrationPolicy.GLOBAL);
                result.addSolution(media, integrated);
            }
            SolutionTester tester = new SolutionTester(this.model);
            List<GapfilledReaction> unneeded = tester.testSolution(cumulative, conditions.getTargets(),
                    conditions.getMedias(), conditions.getThresholds(), parms.isRemoveUnneeded(), null);
            this.dropUnneeded(cumulative, unneeded, result);
            log.info("Unneeded in global gapfill: {}.", unneeded);
            retVal = true;
        }
        return retVal;
    }

    /**
     * Remove the reactions found unneeded by a joint need test from the run's cumulative list and from
     * the cumulative gapfilling of the model.
     *
     * @param cumulative	cumulative list of retained reactions for the run
     * @param unneeded		reactions found unneeded
     * @param result		result object to update
     */
    private void dropUnneeded(List<GapfilledReaction> cumulative, List<GapfilledReaction> unneeded,
            MultiGapfillResult result) {
        cumulative.removeAll(unneeded);
        this.cumulativeGapfilling.removeAll(unneeded);
        result.setUnneeded(unneeded);
    }

    /**
     * Run biomass sensitivity analysis on the solutions of a multi-media run.  Each gapfilled reaction
     * direction is analyzed once, in the first growing media whose solution contains it.  The results are
     * stored in the sensitivity report.
     *
     * @param result	result of the multi-media run
     */
    private void runSensitivityAnalysis(MultiGapfillResult result) {
        log.info("Gapfilling sensitivity analysis running.");
        Map<GapfilledReaction, Media> reactionMedia = new LinkedHashMap<GapfilledReaction, Media>();
        Map<Media, List<GapfilledReaction>> mediaReactions = new LinkedHashMap<Media, List<GapfilledReaction>>();
        for (Map.Entry<Media, GapfillSolution> entry : result.getSolutions().entrySet()) {
            if (entry.getValue().getGrowth() > 0.0) {
                for (GapfilledReaction item : entry.getValue().toList()) {
                    if (! reactionMedia.containsKey(item)) {
                        reactionMedia.put(item, entry.getKey());
                        mediaReactions.computeIfAbsent(entry.getKey(), x -> new ArrayList<GapfilledReaction>()).add(item);
                    }
                }
            }
        }
        Map<String, Map<Direction, List<String>>> sensitivity = new HashMap<String, Map<Direction, List<String>>>();
        for (Map.Entry<Media, List<GapfilledReaction>> entry : mediaReactions.entrySet()) {
            String target = result.getSolution(entry.getKey()).getTarget();
            try (ModelScope scope = this.model.openScope()) {
                this.model.setMedia(entry.getKey());
                var found = this.analyzer.findUnproducibleBiomassCompounds(this.model, target, entry.getValue());
                if (found != null) {
                    for (var rxnEntry : found.entrySet())
                        sensitivity.computeIfAbsent(rxnEntry.getKey(), x -> new HashMap<Direction, List<String>>())
                                .putAll(rxnEntry.getValue());
                }
            }
        }
        SensitivityReport report = this.attributes.getSensitivity();
        for (Map.Entry<Media, GapfillSolution> entry : result.getSolutions().entrySet()) {
            String mediaId = entry.getKey().getId();
            GapfillSolution solution = entry.getValue();
            if (solution.getGrowth() > 0.0) {
                for (GapfilledReaction item : solution.toList()) {
                    Map<Direction, List<String>> dirMap = sensitivity.get(item.getReactionId());
                    List<String> compounds = (dirMap == null ? null : dirMap.get(item.getDirection()));
                    report.recordSuccess(mediaId, solution.getTarget(), item.getReactionId(), item.getDirection(), compounds);
                }
            } else
                report.recordFailure(mediaId, solution.getTarget());
        }
    }

    /**
     * Gapfill the model for a single media and integrate the solution.
     *
     * @param media		media to gapfill
     * @param target	target reaction ID, or NULL to use the default
     *
     * @return the integrated solution, or NULL if no solution was found
     */
    public GapfillSolution gapfill(Media media, String target) {
        GapfillSolution retVal = null;
        GapfillSolution solution = this.runGapfilling(media, target, Double.NaN, false, true);
        if (solution != null)
            retVal = this.integrateGapfillSolution(solution, new ArrayList<GapfilledReaction>(), false, true,
                    IntegrationPolicy.SEQUENTIAL);
        return retVal;
    }

    /**
     * Specify the conditions the gapfilling database must not violate.
     *
     * @param testConditions 	the test conditions to use
     */
    public void setTestConditions(List<TestCondition> testConditions) {
        this.testConditions = new ArrayList<TestCondition>(testConditions);
    }

    /**
     * @return the test conditions
     */
    public List<TestCondition> getTestConditions() {
        return Collections.unmodifiableList(this.testConditions);
    }

    /**
     * Specify the reaction scores used to assign genes.
     *
     * @param reactionScores 	map of core reaction IDs to gene IDs to probabilities
     */
    public void setReactionScores(Map<String, Map<String, Double>> reactionScores) {
        this.reactionScores = reactionScores;
    }

    /**
     * @return the model attributes
     */
    public ModelAttributes getAttributes() {
        return this.attributes;
    }

    /**
     * Specify the model attributes.  Filter results and sensitivity data are recorded here.
     *
     * @param attributes 	the attributes to use
     */
    public void setAttributes(ModelAttributes attributes) {
        this.attributes = attributes;
    }

    /**
     * @return the solutions integrated into the model
     */
    public List<GapfillSolution> getIntegratedGapfillings() {
        return Collections.unmodifiableList(this.integratedGapfillings);
    }

    /**
     * @return all the reactions retained by integration
     */
    public List<GapfilledReaction> getCumulativeGapfilling() {
        return Collections.unmodifiableList(this.cumulativeGapfilling);
    }

    /**
     * @return the reliability scorer
     */
    public ReliabilityScorer getScorer() {
        return this.scorer;
    }

    /**
     * Specify the reliability scorer used to order the prefilter search.
     *
     * @param scorer 	the scorer to use
     */
    public void setScorer(ReliabilityScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Specify the metabolite charges used to penalize charge transport when ordering the prefilter search.
     *
     * @param metaboliteCharges		map of metabolite IDs to charges, or NULL if charges are unknown
     */
    public void setMetaboliteCharges(Map<String, Double> metaboliteCharges) {
        this.metaboliteCharges = metaboliteCharges;
    }

    /**
     * Specify whether prefiltering uses a binary search.
     *
     * @param binarySearch 	TRUE for a binary search, FALSE for a linear one
     */
    public void setBinarySearch(boolean binarySearch) {
        this.binarySearch = binarySearch;
    }

    /**
     * @return the default target reaction ID
     */
    public String getDefaultTarget() {
        return this.defaultTarget;
    }

    /**
     * Specify the default target reaction.
     *
     * @param defaultTarget 	the target reaction ID
     */
    public void setDefaultTarget(String defaultTarget) {
        this.defaultTarget = defaultTarget;
    }

    /**
     * @return the default minimum objective
     */
    public double getDefaultMinObjective() {
        return this.defaultMinObjective;
    }

    /**
     * Specify the default minimum objective.
     *
     * @param defaultMinObjective 	the minimum objective to use
     */
    public void setDefaultMinObjective(double defaultMinObjective) {
        this.defaultMinObjective = defaultMinObjective;
    }

    /**
     * @return the last gapfilling solution computed, or NULL if there is none
     */
    public GapfillSolution getLastSolution() {
        return this.lastSolution;
    }

    /**
     * @return the live model
     */
    public FluxModel getModel() {
        return this.model;
    }

}

/**
 *
 */
package org.theseed.gapfill;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.FluxSolution;
import org.theseed.gapfill.model.LinearFluxModel;
import org.theseed.gapfill.model.Media;
import org.theseed.gapfill.model.ModelReaction;
import org.theseed.gapfill.model.ModelScope;
import org.theseed.gapfill.model.Objective;
import org.theseed.gapfill.reduce.CandidateReaction;

/**
 * This is a gapfilling package for a toy network.  The gapfilling model is a copy of the live model
 * with the database reactions added.  Solving maximizes the target, and every database reaction
 * carrying flux is reported as gapfilled.
 *
 * The toy network takes up one of c1, c2, c3, or c4.  The first three can be converted to x by
 * R1, R2, and R3, and x is converted to y by R0.  The biomass reaction bio1 consumes y.  Only the
 * biomass and exchange reactions are in the live model.
 */
public class FakeGapfillingPackage implements GapfillingPackage {

    // FIELDS
    /** gapfilling model */
    private FluxModel gfModel;
    /** IDs of the database reactions */
    private List<String> databaseIds;
    /** last solution computed */
    private FluxSolution lastSolution;
    /** exclusion lists passed to the penalty computation */
    private List<List<GapfilledReaction>> penaltyCalls;
    /** number of times the objective was rebuilt */
    private int buildCount;
    /** number of binary checks */
    private int binaryCount;
    /** TRUE if the max-flux variables were created */
    private boolean maxFluxCreated;
    /** minimum flux considered nonzero */
    private static final double EPSILON = 1e-8;

    /**
     * Construct a gapfilling package for a live model.
     *
     * @param liveModel		model to gapfill
     */
    public FakeGapfillingPackage(FluxModel liveModel) {
        this.gfModel = liveModel.copy();
        this.databaseIds = List.of("R1", "R2", "R3", "R0");
        this.gfModel.addReaction(new ModelReaction("R1", "c1 to x", 0.0, 1000.0).addStoich("c1", -1.0).addStoich("x", 1.0));
        this.gfModel.addReaction(new ModelReaction("R2", "c2 to x", 0.0, 1000.0).addStoich("c2", -1.0).addStoich("x", 1.0));
        this.gfModel.addReaction(new ModelReaction("R3", "c3 to x", 0.0, 1000.0).addStoich("c3", -1.0).addStoich("x", 1.0));
        this.gfModel.addReaction(new ModelReaction("R0", "x to y", 0.0, 1000.0).addStoich("x", -1.0).addStoich("y", 1.0));
        this.gfModel.setObjective(Objective.of("bio1"));
        this.penaltyCalls = new ArrayList<List<GapfilledReaction>>();
        this.buildCount = 0;
        this.binaryCount = 0;
        this.maxFluxCreated = false;
    }

    /**
     * @return a live toy model with the exchange and biomass reactions only
     */
    public static LinearFluxModel buildLiveModel() {
        return buildLiveModel(new LinearFluxModel("toy"));
    }

    /**
     * Fill an empty model with the exchange and biomass reactions of the live toy model.
     *
     * @param retVal	empty model to fill
     *
     * @return the filled model
     */
    public static <T extends FluxModel> T buildLiveModel(T retVal) {
        for (String cpd : new String[] { "c1", "c2", "c3", "c4" })
            retVal.addExchange(cpd, "EX_" + cpd, 100.0);
        retVal.addReaction(new ModelReaction("bio1", "biomass", 0.0, 1000.0).addStoich("y", -1.0));
        retVal.setObjective(Objective.of("bio1"));
        return retVal;
    }

    @Override
    public FluxModel getModel() {
        return this.gfModel;
    }

    @Override
    public void setBaseObjective(String target, double minObjective) {
        this.gfModel.setObjective(Objective.of(target));
    }

    @Override
    public void setMedia(Media media) {
        this.gfModel.setMedia(media);
    }

    @Override
    public boolean testGapfillDatabase(List<CandidateReaction> activeReactions) {
        FluxSolution solution = this.gfModel.solve();
        boolean retVal = solution.isOptimal() && solution.getObjectiveValue() > EPSILON;
        if (retVal) {
            for (String id : this.databaseIds) {
                if (solution.getFlux(id) > EPSILON)
                    activeReactions.add(new CandidateReaction(id, Direction.FORWARD));
            }
        }
        return retVal;
    }

    @Override
    public boolean isTestInfeasible() {
        return false;
    }

    @Override
    public List<CandidateReaction> getCandidateReactions() {
        List<CandidateReaction> retVal = new ArrayList<CandidateReaction>();
        for (String id : this.databaseIds)
            retVal.add(new CandidateReaction(id, Direction.FORWARD));
        return retVal;
    }

    @Override
    public FluxSolution solve() {
        this.lastSolution = this.gfModel.solve();
        return this.lastSolution;
    }

    @Override
    public GapfillSolution computeGapfilledSolution(Map<String, Map<Direction, Double>> fluxValues) {
        GapfillSolution retVal = new GapfillSolution();
        for (String id : this.databaseIds) {
            double flux;
            if (fluxValues == null)
                flux = this.lastSolution.getFlux(id);
            else
                flux = fluxValues.getOrDefault(id, Map.of()).getOrDefault(Direction.FORWARD, 0.0);
            if (flux > EPSILON)
                retVal.add(id, Direction.FORWARD, GapfilledReaction.Type.NEW);
        }
        return retVal;
    }

    @Override
    public GapfillSolution binaryCheckGapfillingSolution(GapfillSolution solution) {
        this.binaryCount++;
        return solution;
    }

    @Override
    public void computeGapfillingPenalties(Collection<GapfilledReaction> exclusion) {
        this.penaltyCalls.add(exclusion == null ? null : new ArrayList<GapfilledReaction>(exclusion));
    }

    @Override
    public void buildGapfillingObjectiveFunction() {
        this.buildCount++;
    }

    @Override
    public Map<String, Map<Direction, Double>> getGapfillingPenalties() {
        Map<String, Map<Direction, Double>> retVal = new HashMap<String, Map<Direction, Double>>();
        for (String id : this.databaseIds)
            retVal.put(id, Map.of(Direction.FORWARD, 1.0));
        return retVal;
    }

    @Override
    public void createMaxFluxVariables() {
        this.maxFluxCreated = true;
    }

    @Override
    public MergedGapfillProblem mergeProblems(List<Media> medias, List<String> targets, List<Double> thresholds) {
        return new MergedProblem(medias, targets, thresholds);
    }

    /**
     * This merged problem solves each media separately and uses the union of the active database
     * reactions.
     */
    private class MergedProblem implements MergedGapfillProblem {

        private List<Media> medias;
        private List<String> targets;
        private List<Double> thresholds;
        private Map<CandidateReaction, Double> coefficients;
        private Set<CandidateReaction> used;

        private MergedProblem(List<Media> medias, List<String> targets, List<Double> thresholds) {
            this.medias = medias;
            this.targets = targets;
            this.thresholds = thresholds;
            this.coefficients = new HashMap<CandidateReaction, Double>();
            this.used = new LinkedHashSet<CandidateReaction>();
        }

        @Override
        public Set<CandidateReaction> getMaxFluxKeys() {
            return new LinkedHashSet<CandidateReaction>(FakeGapfillingPackage.this.getCandidateReactions());
        }

        @Override
        public void setObjective(Map<CandidateReaction, Double> coefficients) {
            this.coefficients = coefficients;
        }

        @Override
        public FluxSolution solve() {
            FluxSolution retVal = null;
            FluxModel model = FakeGapfillingPackage.this.gfModel;
            for (int i = 0; retVal == null && i < this.medias.size(); i++) {
                try (ModelScope scope = model.openScope()) {
                    model.setMedia(this.medias.get(i));
                    model.setObjective(Objective.of(this.targets.get(i)));
                    FluxSolution solution = model.solve();
                    if (! solution.isOptimal() || solution.getObjectiveValue() < this.thresholds.get(i))
                        retVal = FluxSolution.failed(FluxSolution.Status.INFEASIBLE);
                    else {
                        for (String id : FakeGapfillingPackage.this.databaseIds) {
                            if (solution.getFlux(id) > EPSILON)
                                this.used.add(new CandidateReaction(id, Direction.FORWARD));
                        }
                    }
                }
            }
            if (retVal == null) {
                double value = 0.0;
                for (CandidateReaction key : this.used)
                    value += this.coefficients.getOrDefault(key, 0.0);
                retVal = new FluxSolution(FluxSolution.Status.OPTIMAL, value, new HashMap<String, Double>());
            }
            return retVal;
        }

        @Override
        public double getPrimal(CandidateReaction key) {
            return (this.used.contains(key) ? 1.0 : 0.0);
        }

    }

    /**
     * @return the exclusion lists passed to the penalty computation, in order
     */
    public List<List<GapfilledReaction>> getPenaltyCalls() {
        return this.penaltyCalls;
    }

    /**
     * @return the number of times the objective was rebuilt
     */
    public int getBuildCount() {
        return this.buildCount;
    }

    /**
     * @return the number of binary checks
     */
    public int getBinaryCount() {
        return this.binaryCount;
    }

    /**
     * @return TRUE if the max-flux variables were created
     */
    public boolean isMaxFluxCreated() {
        return this.maxFluxCreated;
    }

}

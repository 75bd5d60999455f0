/**
 *
 */
package org.theseed.gapfill;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.theseed.gapfill.conditions.TestCondition;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.FluxSolution;
import org.theseed.gapfill.model.LinearFluxModel;
import org.theseed.gapfill.model.Media;
import org.theseed.gapfill.model.ModelReaction;
import org.theseed.gapfill.model.Objective;
import org.theseed.gapfill.reduce.CandidateReaction;

/**
 * Tests for multi-media gapfilling on a toy network.
 */
public class MultiMediaGapfillerTest {

    private static final Media M1 = new Media("M1", "c1");
    private static final Media M2 = new Media("M2", "c2");
    private static final Media M3 = new Media("M3", "c3");
    private static final Media M4 = new Media("M4", "c4");
    private static final Media M12 = new Media("M12", "c1", "c2");

    /**
     * This is a linear model whose solves can be made to fail on demand.
     */
    private static class FailingFluxModel extends LinearFluxModel {

        /** TRUE if solves should fail */
        private boolean failing;

        public FailingFluxModel() {
            super("toy");
            this.failing = false;
        }

        @Override
        public FluxSolution solve() {
            if (this.failing)
                throw new IllegalStateException("Solver failure in model " + this.getId() + ".");
            return super.solve();
        }

    }

    @Test
    public void testDatabaseTest() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        FakeGapfillingPackage gfPackage = new FakeGapfillingPackage(model);
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, gfPackage);
        List<CandidateReaction> active = new ArrayList<CandidateReaction>();
        assertThat(gapfiller.testGapfillDatabase(M2, "bio1", true, active), equalTo(true));
        assertThat(active, containsInAnyOrder(new CandidateReaction("R2", Direction.FORWARD),
                new CandidateReaction("R0", Direction.FORWARD)));
        active.clear();
        assertThat(gapfiller.testGapfillDatabase(M4, null, true, active), equalTo(false));
        assertThat(active, empty());
        SensitivityReport.Entry entry = gapfiller.getAttributes().getSensitivity().getEntry("M4", "bio1");
        assertThat(entry.getBeforeFiltering(), contains("y"));
        assertThat(entry.getAfterFiltering(), nullValue());
        MultiMediaGapfiller.ConditionSet conditions = gapfiller.testAndAdjustGapfillingConditions(List.of(M1, M4, M3),
                List.of("bio1", "bio1", "bio1"), List.of(0.01, 0.01, 0.5), false);
        assertThat(conditions.getMedias(), contains(M1, M3));
        assertThat(conditions.getThresholds(), contains(0.01, 0.5));
        assertThat(conditions.getActiveReactions().get(1), hasItem(new CandidateReaction("R3", Direction.FORWARD)));
    }

    @Test
    public void testSingleGapfill() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        FakeGapfillingPackage gfPackage = new FakeGapfillingPackage(model);
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, gfPackage);
        gapfiller.setReactionScores(Map.of("R1", Map.of("g1", 0.2, "g2", 0.9)));
        GapfillSolution solution = gapfiller.runGapfilling(M1, null, Double.NaN, true, false);
        assertThat(solution.getNew().keySet(), containsInAnyOrder("R1", "R0"));
        assertThat(solution.getTarget(), equalTo("bio1"));
        assertThat(solution.getMinObjective(), equalTo(0.01));
        assertThat(solution.isBinaryCheck(), equalTo(true));
        assertThat(gfPackage.getBinaryCount(), equalTo(1));
        assertThat(gapfiller.getLastSolution(), sameInstance(solution));
        // Nothing is in the live model until integration.
        assertThat(model.hasReaction("R1"), equalTo(false));
        GapfillSolution integrated = gapfiller.integrateGapfillSolution(solution, new ArrayList<GapfilledReaction>(),
                true, true, IntegrationPolicy.SEQUENTIAL);
        assertThat(integrated.getNew().keySet(), containsInAnyOrder("R1", "R0"));
        assertThat(integrated.getGrowth(), closeTo(100.0, 1e-6));
        assertThat(model.getUpperBound("R1"), equalTo(MultiMediaGapfiller.GAPFILL_BOUND));
        assertThat(model.getLowerBound("R1"), equalTo(0.0));
        ModelReaction r1 = model.getReaction("R1");
        assertThat(r1.getGeneRule(), equalTo("g2"));
        assertThat(r1.getNote(MultiMediaGapfiller.NEW_GENES_NOTE), equalTo("g2"));
        assertThat(model.getReaction("R0").hasGenes(), equalTo(false));
        assertThat(gapfiller.getIntegratedGapfillings(), contains(integrated));
        assertThat(gapfiller.getCumulativeGapfilling().size(), equalTo(2));
        assertThat(model.getObjective().getId(), equalTo("bio1"));
    }

    @Test
    public void testNoSolution() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, new FakeGapfillingPackage(model));
        assertThat(gapfiller.runGapfilling(M4, "bio1", 0.1, false, false), nullValue());
        assertThat(gapfiller.gapfill(M4, null), nullValue());
        assertThat(gapfiller.getIntegratedGapfillings(), empty());
    }

    @Test
    public void testGapfillConvenience() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, new FakeGapfillingPackage(model));
        GapfillSolution solution = gapfiller.gapfill(M2, null);
        assertThat(solution.getNew().keySet(), containsInAnyOrder("R2", "R0"));
        assertThat(solution.getGrowth(), closeTo(100.0, 1e-6));
        assertThat(model.hasReaction("R2"), equalTo(true));
    }

    @Test
    public void testPrefilter() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        FakeGapfillingPackage gfPackage = new FakeGapfillingPackage(model);
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, gfPackage);
        // Growth on c3 is forbidden.
        TestCondition noC3 = new TestCondition(new Media("T3", "c3"), Objective.of("bio1"), true, 0.5);
        gapfiller.setTestConditions(List.of(noC3));
        GapfillSolution solution = gapfiller.runGapfilling(M1, "bio1", 0.01, false, true);
        assertThat(solution.getNew().keySet(), containsInAnyOrder("R1", "R0"));
        assertThat(gfPackage.getModel().getUpperBound("R3"), equalTo(0.0));
        assertThat(gfPackage.getModel().getUpperBound("R0"), equalTo(1000.0));
        assertThat(gfPackage.getModel().getUpperBound("R2"), equalTo(1000.0));
        assertThat(gapfiller.getAttributes().getFilterCache().contains(noC3,
                new CandidateReaction("R3", Direction.FORWARD)), equalTo(true));
        // M3 can no longer be gapfilled.
        assertThat(gapfiller.runGapfilling(M3, "bio1", 0.01, false, false), nullValue());
        SensitivityReport.Entry entry = gapfiller.getAttributes().getSensitivity().getEntry("M3", "bio1");
        assertThat(entry.getAfterFiltering(), contains("y"));
        // With no test conditions, prefiltering does nothing.
        gapfiller.setTestConditions(List.of());
        assertThat(gapfiller.prefilter(null, null, true, null), equalTo(true));
    }

    @Test
    public void testPrefilterOutcomes() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        FakeGapfillingPackage gfPackage = new FakeGapfillingPackage(model);
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, gfPackage);
        // A condition every database state passes filters nothing.
        TestCondition cond = new TestCondition(new Media("T2", "c2"), Objective.of("bio1"), true, 200.0);
        gapfiller.setTestConditions(List.of(cond));
        assertThat(gapfiller.prefilter(null, List.of(TestCondition.growth(M1, "bio1", 0.01)), false, null),
                equalTo(true));
        for (String id : List.of("R0", "R1", "R2", "R3"))
            assertThat(id, gfPackage.getModel().getUpperBound(id), equalTo(1000.0));
        // A condition that can never pass yields no solution and leaves the database alone.
        TestCondition never = new TestCondition(new Media("T4", "c4"), Objective.of("bio1"), false, 10.0);
        assertThat(gapfiller.prefilter(List.of(never), null, false, null), equalTo(false));
        assertThat(gfPackage.getModel().getUpperBound("R1"), equalTo(1000.0));
    }

    @Test
    public void testRejectedPrefilter() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        FakeGapfillingPackage gfPackage = new FakeGapfillingPackage(model);
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, gfPackage);
        TestCondition never = new TestCondition(new Media("T4", "c4"), Objective.of("bio1"), false, 10.0);
        gapfiller.setTestConditions(List.of(never));
        assertThat(gapfiller.runGapfilling(M1, "bio1", 0.01, false, true), nullValue());
        assertThat(gapfiller.getLastSolution(), nullValue());
        // Without prefiltering the same media can be gapfilled.
        assertThat(gapfiller.runGapfilling(M1, "bio1", 0.01, false, false), notNullValue());
        MultiMediaGapfiller.ConditionSet conditions = gapfiller.testAndAdjustGapfillingConditions(List.of(M1, M2),
                List.of("bio1", "bio1"), List.of(0.01, 0.01), true);
        assertThat(conditions.isEmpty(), equalTo(true));
        assertThat(gapfiller.gapfill(M2, null), nullValue());
        assertThat(model.hasReaction("R2"), equalTo(false));
        GapfillParms parms = new GapfillParms().setMode(IntegrationPolicy.INDEPENDENT).setPrefilter(true);
        assertThat(gapfiller.runMultiGapfill(List.of(M1, M2), parms, null, null), nullValue());
        assertThat(gapfiller.runGlobalGapfilling(List.of(M1, M2), List.of("bio1", "bio1"), List.of(0.01, 0.01),
                false, true), nullValue());
        assertThat(gapfiller.getIntegratedGapfillings(), empty());
    }

    @Test
    public void testIntegrationRestoresModel() {
        FailingFluxModel model = FakeGapfillingPackage.buildLiveModel(new FailingFluxModel());
        FakeGapfillingPackage gfPackage = new FakeGapfillingPackage(model);
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, gfPackage);
        double ex1 = model.getLowerBound("EX_c1");
        double ex2 = model.getLowerBound("EX_c2");
        List<GapfilledReaction> cumulative = new ArrayList<GapfilledReaction>();
        GapfillSolution first = gapfiller.runGapfilling(M1, "bio1", 0.01, false, false);
        gapfiller.integrateGapfillSolution(first, cumulative, true, true, IntegrationPolicy.INDEPENDENT);
        // A model with no media is left with no media and its original exchange bounds.
        assertThat(model.getMedia(), nullValue());
        assertThat(model.getLowerBound("EX_c1"), equalTo(ex1));
        assertThat(model.getObjective().getId(), equalTo("bio1"));
        assertThat(cumulative.size(), equalTo(2));
        GapfillSolution second = gapfiller.runGapfilling(M2, "bio1", 0.01, false, false);
        assertThat(second.getNew().keySet(), containsInAnyOrder("R2", "R0"));
        model.failing = true;
        assertThrows(IllegalStateException.class, () -> gapfiller.integrateGapfillSolution(second, cumulative, true,
                true, IntegrationPolicy.INDEPENDENT));
        // The earlier reactions hidden during the failed integration are open again.
        assertThat(model.getUpperBound("R1"), equalTo(MultiMediaGapfiller.GAPFILL_BOUND));
        assertThat(model.getUpperBound("R0"), equalTo(MultiMediaGapfiller.GAPFILL_BOUND));
        assertThat(model.getMedia(), nullValue());
        assertThat(model.getLowerBound("EX_c2"), equalTo(ex2));
        assertThat(model.getObjective().getId(), equalTo("bio1"));
        assertThat(cumulative.size(), equalTo(2));
        assertThat(gapfiller.getIntegratedGapfillings().size(), equalTo(1));
    }

    @Test
    public void testJointTestPrunesCumulative() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, new FakeGapfillingPackage(model));
        GapfillParms parms = new GapfillParms().setMode(IntegrationPolicy.INDEPENDENT).setPrefilter(false);
        // M12 keeps R2; M1 then needs R1, which makes R2 redundant for both medias.
        MultiGapfillResult result = gapfiller.runMultiGapfill(List.of(M12, M1), parms, null, null);
        GapfilledReaction r2 = new GapfilledReaction("R2", Direction.FORWARD, GapfilledReaction.Type.NEW);
        assertThat(result.getUnneeded(), contains(r2));
        assertThat(result.getRetainedReactionIds(), contains("R0", "R1"));
        assertThat(gapfiller.getCumulativeGapfilling(), not(hasItem(r2)));
        assertThat(gapfiller.getCumulativeGapfilling().size(), equalTo(2));
        assertThat(model.hasReaction("R2"), equalTo(false));
    }

    /**
     * Run a multi-media gapfill of M1, M2, and M3 under a policy.
     *
     * @param policy	integration policy to use
     */
    private void checkThreeMedias(IntegrationPolicy policy) {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        FakeGapfillingPackage gfPackage = new FakeGapfillingPackage(model);
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, gfPackage);
        GapfillParms parms = new GapfillParms().setMode(policy).setPrefilter(false);
        MultiGapfillResult result = gapfiller.runMultiGapfill(List.of(M1, M2, M3), parms, null, null);
        assertThat(policy.toString(), result.getRetainedReactionIds(), contains("R0", "R1", "R2", "R3"));
        assertThat(policy.toString(), result.getFailures(), empty());
        assertThat(result.isPartial(), equalTo(false));
        assertThat(result.getSolutions().keySet(), contains(M1, M2, M3));
        assertThat(result.getSolution(M2).getNew().keySet(), hasItem("R2"));
        assertThat(result.getSolution(M2).getNew().keySet(), not(hasItem("R1")));
        for (GapfillSolution solution : result.getSolutions().values())
            assertThat(solution.getGrowth(), closeTo(100.0, 1e-6));
        for (String id : List.of("R0", "R1", "R2", "R3")) {
            assertThat(model.hasReaction(id), equalTo(true));
            assertThat(id, model.getUpperBound(id), equalTo(MultiMediaGapfiller.GAPFILL_BOUND));
        }
        assertThat(gapfiller.getIntegratedGapfillings().size(), equalTo(3));
        if (policy == IntegrationPolicy.SEQUENTIAL) {
            List<List<GapfilledReaction>> calls = gfPackage.getPenaltyCalls();
            assertThat(calls.size(), equalTo(4));
            assertThat(calls.get(0).size(), equalTo(2));
            assertThat(calls.get(3), nullValue());
            assertThat(gfPackage.getBuildCount(), equalTo(4));
        } else
            assertThat(gfPackage.getPenaltyCalls(), empty());
        assertThat(gfPackage.isMaxFluxCreated(), equalTo(policy == IntegrationPolicy.GLOBAL));
    }

    @Test
    public void testPolicies() {
        for (IntegrationPolicy policy : IntegrationPolicy.values())
            this.checkThreeMedias(policy);
    }

    @Test
    public void testSingleMediaPolicies() {
        for (IntegrationPolicy policy : IntegrationPolicy.values()) {
            FluxModel model = FakeGapfillingPackage.buildLiveModel();
            MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, new FakeGapfillingPackage(model));
            GapfillParms parms = new GapfillParms().setMode(policy);
            MultiGapfillResult result = gapfiller.runMultiGapfill(List.of(M1), parms, null, null);
            assertThat(policy.toString(), result.getRetainedReactionIds(), contains("R0", "R1"));
            assertThat(result.getUnneeded(), empty());
        }
    }

    @Test
    public void testPartialFailure() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, new FakeGapfillingPackage(model));
        GapfillParms parms = new GapfillParms().setMode(IntegrationPolicy.INDEPENDENT).setPrefilter(false);
        MultiGapfillResult result = gapfiller.runMultiGapfill(List.of(M4, M1), parms,
                Map.of(M1, "bio1"), Map.of(M1, 0.5));
        assertThat(result.isPartial(), equalTo(true));
        assertThat(result.getFailures(), contains(M4));
        assertThat(result.getSolutions().keySet(), contains(M1));
        assertThat(result.getSolution(M1).getMinObjective(), equalTo(0.5));
        assertThat(result.getRetainedReactionIds(), contains("R0", "R1"));
        SensitivityReport.Entry entry = gapfiller.getAttributes().getSensitivity().getEntry("M4", "bio1");
        assertThat(entry.getBeforeFiltering(), contains("y"));
        // A run with no gapfillable media has no result.
        assertThat(gapfiller.runMultiGapfill(List.of(M4), parms, null, null), nullValue());
    }

    @Test
    public void testSensitivity() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, new FakeGapfillingPackage(model));
        GapfillParms parms = new GapfillParms().setMode(IntegrationPolicy.SEQUENTIAL).setSensitivity(true);
        MultiGapfillResult result = gapfiller.runMultiGapfill(List.of(M1, M2), parms, null, null);
        assertThat(result, notNullValue());
        SensitivityReport report = gapfiller.getAttributes().getSensitivity();
        SensitivityReport.Entry entry = report.getEntry("M1", "bio1");
        assertThat(entry.isFailure(), equalTo(false));
        assertThat(entry.getSuccess().get("R1").get(Direction.FORWARD), contains("y"));
        assertThat(entry.getSuccess().get("R0").get(Direction.FORWARD), contains("y"));
        entry = report.getEntry("M2", "bio1");
        assertThat(entry.getSuccess().get("R2").get(Direction.FORWARD), contains("y"));
        // The analysis leaves the live model intact.
        assertThat(model.getUpperBound("R1"), equalTo(MultiMediaGapfiller.GAPFILL_BOUND));
        assertThat(model.hasReaction("DM_probe_y"), equalTo(false));
    }

    @Test
    public void testNoIntegrate() {
        FluxModel model = FakeGapfillingPackage.buildLiveModel();
        MultiMediaGapfiller gapfiller = new MultiMediaGapfiller(model, new FakeGapfillingPackage(model));
        GapfillParms parms = new GapfillParms().setMode(IntegrationPolicy.GLOBAL).setIntegrate(false);
        MultiGapfillResult result = gapfiller.runMultiGapfill(List.of(M1, M2), parms, null, null);
        assertThat(result.getRetainedReactionIds(), contains("R0", "R1", "R2"));
        assertThat(model.hasReaction("R1"), equalTo(false));
        assertThat(model.hasReaction("R0"), equalTo(false));
        assertThat(gapfiller.getModel(), sameInstance(model));
        assertThat(gapfiller.getIntegratedGapfillings(), empty());
    }

}

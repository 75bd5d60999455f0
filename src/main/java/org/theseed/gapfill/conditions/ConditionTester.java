/**
 *
 */
package org.theseed.gapfill.conditions;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.model.FluxModel;
import org.theseed.gapfill.model.FluxSolution;

/**
 * This object applies test conditions to a flux model and checks the resulting objective
 * against the condition thresholds.  It remembers the last objective value computed (the score)
 * and the last passing objective, which is the baseline for change-mode conditions.
 *
 * A solve that does not produce an optimal solution counts as a failed test.
 */
public class ConditionTester {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConditionTester.class);
    /** model being tested */
    private FluxModel model;
    /** objective value from the last passing test, or NaN if there is none */
    private double testObjective;
    /** value computed by the last test */
    private double score;

    /**
     * Construct a condition tester for a model.
     *
     * @param model		model to test
     */
    public ConditionTester(FluxModel model) {
        this.model = model;
        this.testObjective = Double.NaN;
        this.score = Double.NaN;
    }

    /**
     * Apply the objective and media of a condition to the model.  The objective is always
     * maximized.
     *
     * @param condition		condition to apply
     */
    public void applyCondition(TestCondition condition) {
        this.model.setObjective(condition.getObjective().withDirection(true));
        this.model.setMedia(condition.getMedia());
    }

    /**
     * Run a single test condition.
     *
     * @param condition		condition to test
     * @param apply			TRUE if the condition must be applied first
     *
     * @return TRUE if the condition passes, FALSE if it fails
     */
    public boolean testSingleCondition(TestCondition condition, boolean apply) {
        if (apply)
            this.applyCondition(condition);
        FluxSolution solution = this.model.solve();
        boolean retVal;
        if (! solution.isOptimal()) {
            log.error("{} testing leads to {} problem.", condition.getMedia(), solution.getStatus());
            if (log.isDebugEnabled())
                log.debug("Problem dump for failed test:{}{}", System.lineSeparator(), this.model.describeProblem());
            this.score = Double.NaN;
            retVal = false;
        } else {
            double newObjective = solution.getObjectiveValue();
            double value = newObjective;
            if (condition.isChange() && ! Double.isNaN(this.testObjective)) {
                value = newObjective - this.testObjective;
                log.debug("{} testing for change: {} = {} - {}.", condition.getMedia(), value, newObjective,
                        this.testObjective);
            }
            this.score = value;
            if (condition.isMaxThreshold() && value >= condition.getThreshold()) {
                log.debug("Failed high: {} {} >= {}.", condition.getMedia(), newObjective, condition.getThreshold());
                retVal = false;
            } else if (! condition.isMaxThreshold() && value <= condition.getThreshold()) {
                log.debug("Failed low: {} {} <= {}.", condition.getMedia(), newObjective, condition.getThreshold());
                retVal = false;
            } else {
                this.testObjective = newObjective;
                log.debug("Passed: {} {} vs {}.", condition.getMedia(), newObjective, condition.getThreshold());
                retVal = true;
            }
        }
        return retVal;
    }

    /**
     * Run a list of test conditions.  Each condition is applied in turn, and the first failure
     * ends the run.
     *
     * @param conditions	conditions to test
     *
     * @return TRUE if all the conditions pass
     */
    public boolean testConditionList(List<TestCondition> conditions) {
        boolean retVal = true;
        for (int i = 0; retVal && i < conditions.size(); i++)
            retVal = this.testSingleCondition(conditions.get(i), true);
        return retVal;
    }

    /**
     * @return the value computed by the last test (NaN if the last solve failed)
     */
    public double getScore() {
        return this.score;
    }

    /**
     * @return the objective from the last passing test (NaN if none)
     */
    public double getTestObjective() {
        return this.testObjective;
    }

    /**
     * Erase the baseline used by change-mode conditions.
     */
    public void clearTestObjective() {
        this.testObjective = Double.NaN;
    }

    /**
     * @return the model being tested
     */
    public FluxModel getModel() {
        return this.model;
    }

}

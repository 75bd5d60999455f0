/**
 *
 */
package org.theseed.gapfill;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * This object contains the tuning parameters for a multi-media gapfilling run.  The parameters can be
 * set directly or parsed from option strings.
 *
 * The options are as follows.
 *
 * --mode			integration policy (Independent, Sequential, Cumulative or Global; default Sequential)
 * --minObj			default minimum objective for each media (default 0.01)
 * --target			default target reaction ID (default "bio1")
 * --binary			if specified, each solution is reduced to a minimal one
 * --noPrefilter	if specified, the gapfilling database is not filtered with the test conditions
 * --noGrowthCheck	if specified, growth is not measured after integration
 * --sensitivity	if specified, biomass sensitivity analysis is run on successful medias
 * --noIntegrate	if specified, the live model is not changed
 * --keepUnneeded	if specified, unneeded reactions are kept in the model
 * --linear			if specified, prefiltering uses a linear search instead of a binary one
 */
public class GapfillParms {

    // OPTIONS

    /** integration policy name */
    @Option(name = "--mode", metaVar = "Sequential", usage = "integration policy for multiple medias")
    private String modeName;

    /** default minimum objective */
    @Option(name = "--minObj", metaVar = "0.1", usage = "default minimum objective for gapfilling")
    private double minObjective;

    /** default target reaction */
    @Option(name = "--target", metaVar = "bio1", usage = "default target reaction ID")
    private String target;

    /** TRUE to reduce each solution to a minimal one */
    @Option(name = "--binary", usage = "if specified, gapfilling solutions will be checked for minimality")
    private boolean binaryCheck;

    /** TRUE to skip prefiltering */
    @Option(name = "--noPrefilter", usage = "if specified, the gapfilling database will not be prefiltered")
    private boolean noPrefilter;

    /** TRUE to skip the growth check */
    @Option(name = "--noGrowthCheck", usage = "if specified, growth will not be checked after integration")
    private boolean noGrowthCheck;

    /** TRUE to run sensitivity analysis */
    @Option(name = "--sensitivity", usage = "if specified, biomass sensitivity analysis will be performed")
    private boolean sensitivity;

    /** TRUE to leave the live model unchanged */
    @Option(name = "--noIntegrate", usage = "if specified, solutions will not be integrated into the model")
    private boolean noIntegrate;

    /** TRUE to keep unneeded reactions */
    @Option(name = "--keepUnneeded", usage = "if specified, unneeded reactions will not be removed")
    private boolean keepUnneeded;

    /** TRUE to use a linear search when prefiltering */
    @Option(name = "--linear", usage = "if specified, prefiltering will use a linear search")
    private boolean linearSearch;

    /** parsed integration policy */
    private IntegrationPolicy mode;

    /**
     * Construct a parameter object with default values.
     */
    public GapfillParms() {
        this.setDefaults();
    }

    /**
     * Set the default values for the parameters.
     */
    public void setDefaults() {
        this.modeName = IntegrationPolicy.SEQUENTIAL.getLabel();
        this.mode = IntegrationPolicy.SEQUENTIAL;
        this.minObjective = 0.01;
        this.target = "bio1";
        this.binaryCheck = false;
        this.noPrefilter = false;
        this.noGrowthCheck = false;
        this.sensitivity = false;
        this.noIntegrate = false;
        this.keepUnneeded = false;
        this.linearSearch = false;
    }

    /**
     * Parse a set of option strings into a parameter object.
     *
     * @param args		option strings to parse
     *
     * @return the parameter object
     *
     * @throws CmdLineException		if an option is invalid
     */
    public static GapfillParms parse(String... args) throws CmdLineException {
        GapfillParms retVal = new GapfillParms();
        CmdLineParser parser = new CmdLineParser(retVal);
        parser.parseArgument(args);
        try {
            retVal.mode = IntegrationPolicy.parse(retVal.modeName);
        } catch (IllegalArgumentException e) {
            throw new CmdLineException(parser, e.getMessage(), e);
        }
        if (retVal.minObjective < 0.0)
            throw new CmdLineException(parser, "Minimum objective cannot be negative.");
        return retVal;
    }

    /**
     * @return the integration policy
     */
    public IntegrationPolicy getMode() {
        return this.mode;
    }

    /**
     * Specify the integration policy.
     *
     * @param mode 	the policy to use
     *
     * @return this object, for chaining
     */
    public GapfillParms setMode(IntegrationPolicy mode) {
        this.mode = mode;
        this.modeName = mode.getLabel();
        return this;
    }

    /**
     * @return the default minimum objective
     */
    public double getMinObjective() {
        return this.minObjective;
    }

    /**
     * Specify the default minimum objective.
     *
     * @param minObjective 	the minimum objective to set
     *
     * @return this object, for chaining
     */
    public GapfillParms setMinObjective(double minObjective) {
        if (minObjective < 0.0)
            throw new IllegalArgumentException("Minimum objective cannot be negative.");
        this.minObjective = minObjective;
        return this;
    }

    /**
     * @return the default target reaction ID
     */
    public String getTarget() {
        return this.target;
    }

    /**
     * Specify the default target reaction.
     *
     * @param target 	the target reaction ID to set
     *
     * @return this object, for chaining
     */
    public GapfillParms setTarget(String target) {
        this.target = target;
        return this;
    }

    /**
     * @return TRUE if solutions should be checked for minimality
     */
    public boolean isBinaryCheck() {
        return this.binaryCheck;
    }

    /**
     * @param binaryCheck 	TRUE if solutions should be checked for minimality
     *
     * @return this object, for chaining
     */
    public GapfillParms setBinaryCheck(boolean binaryCheck) {
        this.binaryCheck = binaryCheck;
        return this;
    }

    /**
     * @return TRUE if the gapfilling database should be prefiltered
     */
    public boolean isPrefilter() {
        return ! this.noPrefilter;
    }

    /**
     * @param prefilter 	TRUE if the gapfilling database should be prefiltered
     *
     * @return this object, for chaining
     */
    public GapfillParms setPrefilter(boolean prefilter) {
        this.noPrefilter = ! prefilter;
        return this;
    }

    /**
     * @return TRUE if growth should be measured after integration
     */
    public boolean isCheckForGrowth() {
        return ! this.noGrowthCheck;
    }

    /**
     * @param checkForGrowth 	TRUE if growth should be measured after integration
     *
     * @return this object, for chaining
     */
    public GapfillParms setCheckForGrowth(boolean checkForGrowth) {
        this.noGrowthCheck = ! checkForGrowth;
        return this;
    }

    /**
     * @return TRUE if sensitivity analysis should be performed
     */
    public boolean isSensitivity() {
        return this.sensitivity;
    }

    /**
     * @param sensitivity 	TRUE if sensitivity analysis should be performed
     *
     * @return this object, for chaining
     */
    public GapfillParms setSensitivity(boolean sensitivity) {
        this.sensitivity = sensitivity;
        return this;
    }

    /**
     * @return TRUE if solutions should be integrated into the live model
     */
    public boolean isIntegrate() {
        return ! this.noIntegrate;
    }

    /**
     * @param integrate 	TRUE if solutions should be integrated into the live model
     *
     * @return this object, for chaining
     */
    public GapfillParms setIntegrate(boolean integrate) {
        this.noIntegrate = ! integrate;
        return this;
    }

    /**
     * @return TRUE if unneeded reactions should be removed
     */
    public boolean isRemoveUnneeded() {
        return ! this.keepUnneeded;
    }

    /**
     * @param removeUnneeded 	TRUE if unneeded reactions should be removed
     *
     * @return this object, for chaining
     */
    public GapfillParms setRemoveUnneeded(boolean removeUnneeded) {
        this.keepUnneeded = ! removeUnneeded;
        return this;
    }

    /**
     * @return TRUE if prefiltering should use a binary search
     */
    public boolean isBinarySearch() {
        return ! this.linearSearch;
    }

    /**
     * @param binarySearch 	TRUE if prefiltering should use a binary search
     *
     * @return this object, for chaining
     */
    public GapfillParms setBinarySearch(boolean binarySearch) {
        this.linearSearch = ! binarySearch;
        return this;
    }

}

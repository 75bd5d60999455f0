/**
 *
 */
package org.theseed.gapfill;

/**
 * This enumeration describes the ways solutions for multiple medias can be combined.
 */
public enum IntegrationPolicy {
    /** each media is gapfilled in isolation, then everything is tested together */
    INDEPENDENT("Independent"),
    /** each media is gapfilled in turn, with prior reactions no longer penalized */
    SEQUENTIAL("Sequential"),
    /** all medias are gapfilled at once in a merged problem */
    GLOBAL("Global");

    /** display name */
    private String label;

    private IntegrationPolicy(String label) {
        this.label = label;
    }

    /**
     * @return the display name
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the integration policy with the specified name
     *
     * @param name		name of the policy (case-insensitive); "Cumulative" is the same as "Sequential"
     *
     * @throws IllegalArgumentException		if the name is not recognized
     */
    public static IntegrationPolicy parse(String name) {
        IntegrationPolicy retVal = null;
        if ("cumulative".equalsIgnoreCase(name))
            retVal = SEQUENTIAL;
        else {
            for (IntegrationPolicy policy : IntegrationPolicy.values()) {
                if (policy.label.equalsIgnoreCase(name) || policy.name().equalsIgnoreCase(name))
                    retVal = policy;
            }
        }
        if (retVal == null)
            throw new IllegalArgumentException("Invalid integration policy \"" + name + "\".");
        return retVal;
    }

    @Override
    public String toString() {
        return this.label;
    }

}

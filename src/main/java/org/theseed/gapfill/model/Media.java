/**
 *
 */
package org.theseed.gapfill.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * A media describes a growth environment.  It is a named collection of exchange compounds,
 * each with the maximum uptake rate allowed.  The media ID is stable and is used as a key for
 * caches and reports.
 */
public class Media {

    // FIELDS
    /** media identifier */
    private String id;
    /** map of compound IDs to maximum uptake */
    private Map<String, Double> uptakes;
    /** default maximum uptake */
    public static final double DEFAULT_UPTAKE = 100.0;

    /**
     * Construct an empty media.
     *
     * @param id	media identifier
     */
    public Media(String id) {
        if (StringUtils.isBlank(id))
            throw new IllegalArgumentException("Media ID cannot be blank.");
        this.id = id;
        this.uptakes = new LinkedHashMap<String, Double>();
    }

    /**
     * Construct a media containing the specified compounds at the default uptake rate.
     *
     * @param id			media identifier
     * @param compounds		IDs of the compounds available
     */
    public Media(String id, String... compounds) {
        this(id);
        for (String compound : compounds)
            this.uptakes.put(compound, DEFAULT_UPTAKE);
    }

    /**
     * Add a compound to this media.
     *
     * @param compound		ID of the compound
     * @param maxUptake		maximum uptake rate
     *
     * @return this object, for chaining
     */
    public Media add(String compound, double maxUptake) {
        this.uptakes.put(compound, maxUptake);
        return this;
    }

    /**
     * @return the media ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return TRUE if the compound is present in this media
     *
     * @param compound	ID of the compound to check
     */
    public boolean contains(String compound) {
        return this.uptakes.containsKey(compound);
    }

    /**
     * @return the maximum uptake rate for a compound, or the default if the compound is absent
     *
     * @param compound		ID of the compound of interest
     * @param defaultUptake	uptake rate to return for a missing compound
     */
    public double getUptake(String compound, double defaultUptake) {
        return this.uptakes.getOrDefault(compound, defaultUptake);
    }

    /**
     * @return the set of compounds in this media
     */
    public Set<String> getCompounds() {
        return Collections.unmodifiableSet(this.uptakes.keySet());
    }

    @Override
    public String toString() {
        return this.id;
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Media other = (Media) obj;
        return this.id.equals(other.id);
    }

}

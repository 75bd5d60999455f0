/**
 *
 */
package org.theseed.gapfill;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.theseed.gapfill.model.Direction;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object records the results of biomass sensitivity analysis.  It is keyed by media ID and target
 * reaction ID.  For each key it can hold the compounds found unproducible when the gapfilling database
 * failed before or after filtering, and for a successful gapfilling the compounds that depend on each
 * gapfilled reaction direction.  A failed gapfilling is recorded with an empty failure marker.
 */
public class SensitivityReport {

    // FIELDS
    /** map of media ID to target ID to sensitivity entry */
    private Map<String, Map<String, Entry>> entries;

    /** label for database failures before filtering */
    public static final String BEFORE_FILTERING = "FBF";
    /** label for database failures after filtering */
    public static final String AFTER_FILTERING = "FAF";
    /** label for successful gapfillings */
    public static final String SUCCESS = "success";
    /** label for failed gapfillings */
    public static final String FAILURE = "failure";

    /**
     * This object contains the sensitivity data for a single media and target.
     */
    public static class Entry {

        /** unproducible compounds when the database failed before filtering, or NULL */
        private List<String> beforeFiltering;
        /** unproducible compounds when the database failed after filtering, or NULL */
        private List<String> afterFiltering;
        /** map of gapfilled reaction IDs to directions to dependent compounds, or NULL */
        private Map<String, Map<Direction, List<String>>> success;
        /** TRUE if the gapfilling failed */
        private boolean failure;

        protected Entry() {
            this.beforeFiltering = null;
            this.afterFiltering = null;
            this.success = null;
            this.failure = false;
        }

        /**
         * @return the unproducible compounds before filtering, or NULL if none were recorded
         */
        public List<String> getBeforeFiltering() {
            return this.beforeFiltering;
        }

        /**
         * @return the unproducible compounds after filtering, or NULL if none were recorded
         */
        public List<String> getAfterFiltering() {
            return this.afterFiltering;
        }

        /**
         * @return the dependent compounds for each gapfilled reaction direction, or NULL if the
         * 		   gapfilling was not successful
         */
        public Map<String, Map<Direction, List<String>>> getSuccess() {
            return this.success;
        }

        /**
         * @return TRUE if the gapfilling failed
         */
        public boolean isFailure() {
            return this.failure;
        }

        /**
         * @return a JSON object for this entry
         */
        protected JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            if (this.beforeFiltering != null)
                retVal.put(BEFORE_FILTERING, new JsonArray(this.beforeFiltering));
            if (this.afterFiltering != null)
                retVal.put(AFTER_FILTERING, new JsonArray(this.afterFiltering));
            if (this.success != null) {
                JsonObject successJson = new JsonObject();
                for (var rxnEntry : this.success.entrySet()) {
                    JsonObject rxnJson = new JsonObject();
                    for (var dirEntry : rxnEntry.getValue().entrySet())
                        rxnJson.put(dirEntry.getKey().getSymbol(), new JsonArray(dirEntry.getValue()));
                    successJson.put(rxnEntry.getKey(), rxnJson);
                }
                retVal.put(SUCCESS, successJson);
            }
            if (this.failure)
                retVal.put(FAILURE, new JsonObject());
            return retVal;
        }

    }

    /**
     * Construct an empty sensitivity report.
     */
    public SensitivityReport() {
        this.entries = new TreeMap<String, Map<String, Entry>>();
    }

    /**
     * @return the entry for a media and target, creating it if necessary
     *
     * @param mediaId	ID of the media
     * @param target	ID of the target reaction
     */
    private Entry getOrCreate(String mediaId, String target) {
        return this.entries.computeIfAbsent(mediaId, x -> new TreeMap<String, Entry>())
                .computeIfAbsent(target, x -> new Entry());
    }

    /**
     * @return the entry for a media and target, or NULL if there is none
     *
     * @param mediaId	ID of the media
     * @param target	ID of the target reaction
     */
    public Entry getEntry(String mediaId, String target) {
        Entry retVal = null;
        Map<String, Entry> targetMap = this.entries.get(mediaId);
        if (targetMap != null)
            retVal = targetMap.get(target);
        return retVal;
    }

    /**
     * Record the unproducible compounds for a failed gapfilling database test.
     *
     * @param mediaId			ID of the media
     * @param target			ID of the target reaction
     * @param beforeFiltering	TRUE if the test was before filtering
     * @param compounds			list of unproducible compounds (NULL is treated as empty)
     */
    public void recordDatabaseFailure(String mediaId, String target, boolean beforeFiltering, Collection<String> compounds) {
        List<String> list = (compounds == null ? new ArrayList<String>() : new ArrayList<String>(compounds));
        Entry entry = this.getOrCreate(mediaId, target);
        if (beforeFiltering)
            entry.beforeFiltering = list;
        else
            entry.afterFiltering = list;
    }

    /**
     * Record the dependent compounds for a gapfilled reaction direction in a successful gapfilling.
     *
     * @param mediaId		ID of the media
     * @param target		ID of the target reaction
     * @param reactionId	ID of the gapfilled reaction
     * @param dir			gapfilled direction
     * @param compounds		list of compounds that depend on the reaction (NULL is treated as empty)
     */
    public void recordSuccess(String mediaId, String target, String reactionId, Direction dir, Collection<String> compounds) {
        Entry entry = this.getOrCreate(mediaId, target);
        if (entry.success == null)
            entry.success = new TreeMap<String, Map<Direction, List<String>>>();
        List<String> list = (compounds == null ? new ArrayList<String>() : new ArrayList<String>(compounds));
        entry.success.computeIfAbsent(reactionId, x -> new EnumMap<Direction, List<String>>(Direction.class)).put(dir, list);
    }

    /**
     * Record a failed gapfilling.
     *
     * @param mediaId		ID of the media
     * @param target		ID of the target reaction
     */
    public void recordFailure(String mediaId, String target) {
        this.getOrCreate(mediaId, target).failure = true;
    }

    /**
     * @return the IDs of the medias in this report
     */
    public Collection<String> getMediaIds() {
        return Collections.unmodifiableSet(this.entries.keySet());
    }

    /**
     * @return TRUE if this report is empty
     */
    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    /**
     * @return a JSON object containing this report
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        for (var mediaEntry : this.entries.entrySet()) {
            JsonObject mediaJson = new JsonObject();
            for (var targetEntry : mediaEntry.getValue().entrySet())
                mediaJson.put(targetEntry.getKey(), targetEntry.getValue().toJson());
            retVal.put(mediaEntry.getKey(), mediaJson);
        }
        return retVal;
    }

    /**
     * Create a sensitivity report from a JSON object.
     *
     * @param json		JSON object produced by {@link #toJson()}
     *
     * @return the sensitivity report described by the object
     *
     * @throws IllegalArgumentException		if the object is malformed
     */
    public static SensitivityReport fromJson(JsonObject json) {
        SensitivityReport retVal = new SensitivityReport();
        try {
            for (var mediaEntry : json.entrySet()) {
                String mediaId = mediaEntry.getKey();
                JsonObject mediaJson = (JsonObject) mediaEntry.getValue();
                for (var targetEntry : mediaJson.entrySet()) {
                    String target = targetEntry.getKey();
                    JsonObject entryJson = (JsonObject) targetEntry.getValue();
                    Entry entry = retVal.getOrCreate(mediaId, target);
                    JsonArray fbf = (JsonArray) entryJson.get(BEFORE_FILTERING);
                    if (fbf != null)
                        retVal.recordDatabaseFailure(mediaId, target, true, toStrings(fbf));
                    JsonArray faf = (JsonArray) entryJson.get(AFTER_FILTERING);
                    if (faf != null)
                        retVal.recordDatabaseFailure(mediaId, target, false, toStrings(faf));
                    JsonObject successJson = (JsonObject) entryJson.get(SUCCESS);
                    if (successJson != null) {
                        entry.success = new TreeMap<String, Map<Direction, List<String>>>();
                        for (var rxnEntry : successJson.entrySet()) {
                            JsonObject rxnJson = (JsonObject) rxnEntry.getValue();
                            for (var dirEntry : rxnJson.entrySet())
                                retVal.recordSuccess(mediaId, target, rxnEntry.getKey(), Direction.parse(dirEntry.getKey()),
                                        toStrings((JsonArray) dirEntry.getValue()));
                        }
                    }
                    if (entryJson.containsKey(FAILURE))
                        entry.failure = true;
                }
            }
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("Invalid sensitivity report structure: " + e.getMessage());
        }
        return retVal;
    }

    /**
     * @return a list of the strings in a JSON array
     *
     * @param array		JSON array of strings
     */
    private static List<String> toStrings(JsonArray array) {
        List<String> retVal = new ArrayList<String>(array.size());
        for (Object item : array)
            retVal.add(item.toString());
        return retVal;
    }

}

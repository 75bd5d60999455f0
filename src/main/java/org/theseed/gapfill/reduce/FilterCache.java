/**
 *
 */
package org.theseed.gapfill.reduce;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

import org.theseed.gapfill.conditions.TestCondition;
import org.theseed.gapfill.model.Direction;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * The filter cache remembers the reactions filtered by earlier expansion searches.  It is keyed by
 * media ID, objective ID and threshold.  Under each key it maps a reaction ID and direction to a
 * record of the original bound and the score of the failing test.
 *
 * The cache can be converted to and from a JSON object nested in the same order as the keys.
 */
public class FilterCache {

    // FIELDS
    /** map of media ID to objective ID to threshold to reaction ID to direction to record */
    private Map<String, Map<String, Map<Double, Map<String, Map<Direction, FilterRecord>>>>> cache;

    private static enum RecordKeys implements JsonKey {
        BOUND(null), SCORE(null);

        private final Object m_value;

        private RecordKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * This object describes a filtered reaction direction.  Either value may be NaN if it was never
     * computed.  Only finite values are written to JSON.
     */
    public static class FilterRecord {

        /** bound before the reaction was filtered */
        private double originalBound;
        /** score of the failing test */
        private double score;

        /**
         * Construct a filter record.
         *
         * @param originalBound		bound before the reaction was filtered
         * @param score				score of the failing test
         */
        public FilterRecord(double originalBound, double score) {
            this.originalBound = originalBound;
            this.score = score;
        }

        /**
         * @return the bound before the reaction was filtered
         */
        public double getOriginalBound() {
            return this.originalBound;
        }

        /**
         * @return the score of the failing test
         */
        public double getScore() {
            return this.score;
        }

        /**
         * @return a JSON object for this record
         */
        protected JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            if (Double.isFinite(this.originalBound))
                retVal.put(RecordKeys.BOUND.getKey(), this.originalBound);
            if (Double.isFinite(this.score))
                retVal.put(RecordKeys.SCORE.getKey(), this.score);
            return retVal;
        }

        /**
         * @return a filter record built from a JSON object
         *
         * @param json		JSON object to parse
         */
        protected static FilterRecord fromJson(JsonObject json) {
            Number bound = (Number) json.get(RecordKeys.BOUND.getKey());
            Number score = (Number) json.get(RecordKeys.SCORE.getKey());
            return new FilterRecord(bound == null ? Double.NaN : bound.doubleValue(),
                    score == null ? Double.NaN : score.doubleValue());
        }

    }

    /**
     * Construct an empty filter cache.
     */
    public FilterCache() {
        this.cache = new TreeMap<String, Map<String, Map<Double, Map<String, Map<Direction, FilterRecord>>>>>();
    }

    /**
     * @return the reaction map for a key, creating it if necessary
     *
     * @param mediaId		ID of the condition media
     * @param objectiveId	ID of the condition objective
     * @param threshold		condition threshold
     */
    private Map<String, Map<Direction, FilterRecord>> getOrCreate(String mediaId, String objectiveId, double threshold) {
        return this.cache.computeIfAbsent(mediaId, x -> new TreeMap<String, Map<Double, Map<String, Map<Direction, FilterRecord>>>>())
                .computeIfAbsent(objectiveId, x -> new TreeMap<Double, Map<String, Map<Direction, FilterRecord>>>())
                .computeIfAbsent(threshold, x -> new TreeMap<String, Map<Direction, FilterRecord>>());
    }

    /**
     * Record a filtered candidate for a condition.  An existing record is not replaced.
     *
     * @param condition		condition that filtered the candidate
     * @param candidate		candidate filtered
     */
    public void record(TestCondition condition, CandidateReaction candidate) {
        this.record(condition.getMedia().getId(), condition.getObjective().getId(), condition.getThreshold(),
                candidate.getReactionId(), candidate.getDirection(),
                new FilterRecord(candidate.getOriginalBound(), candidate.getScore()));
    }

    /**
     * Record a filtered reaction direction.  An existing record is not replaced.
     *
     * @param mediaId		ID of the condition media
     * @param objectiveId	ID of the condition objective
     * @param threshold		condition threshold
     * @param reactionId	ID of the filtered reaction
     * @param dir			direction filtered
     * @param record		filter record to store
     */
    public void record(String mediaId, String objectiveId, double threshold, String reactionId, Direction dir,
            FilterRecord record) {
        this.getOrCreate(mediaId, objectiveId, threshold)
                .computeIfAbsent(reactionId, x -> new EnumMap<Direction, FilterRecord>(Direction.class))
                .putIfAbsent(dir, record);
    }

    /**
     * @return the filter records for a condition, as a map from reaction ID to direction to record
     *
     * @param condition		condition of interest
     */
    public Map<String, Map<Direction, FilterRecord>> getFiltered(TestCondition condition) {
        Map<String, Map<Direction, FilterRecord>> retVal = Collections.emptyMap();
        var objMap = this.cache.get(condition.getMedia().getId());
        if (objMap != null) {
            var threshMap = objMap.get(condition.getObjective().getId());
            if (threshMap != null) {
                var found = threshMap.get(condition.getThreshold());
                if (found != null)
                    retVal = Collections.unmodifiableMap(found);
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if a candidate has been filtered for a condition
     *
     * @param condition		condition of interest
     * @param candidate		candidate of interest
     */
    public boolean contains(TestCondition condition, CandidateReaction candidate) {
        Map<Direction, FilterRecord> dirMap = this.getFiltered(condition).get(candidate.getReactionId());
        return (dirMap != null && dirMap.containsKey(candidate.getDirection()));
    }

    /**
     * @return the total number of filter records in the cache
     */
    public int size() {
        int retVal = 0;
        for (var objMap : this.cache.values()) {
            for (var threshMap : objMap.values()) {
                for (var rxnMap : threshMap.values()) {
                    for (var dirMap : rxnMap.values())
                        retVal += dirMap.size();
                }
            }
        }
        return retVal;
    }

    /**
     * Merge another filter cache into this one.  Existing records are not replaced.
     *
     * @param other		filter cache to merge in
     */
    public void merge(FilterCache other) {
        for (var mediaEntry : other.cache.entrySet()) {
            for (var objEntry : mediaEntry.getValue().entrySet()) {
                for (var threshEntry : objEntry.getValue().entrySet()) {
                    for (var rxnEntry : threshEntry.getValue().entrySet()) {
                        for (var dirEntry : rxnEntry.getValue().entrySet())
                            this.record(mediaEntry.getKey(), objEntry.getKey(), threshEntry.getKey(), rxnEntry.getKey(),
                                    dirEntry.getKey(), dirEntry.getValue());
                    }
                }
            }
        }
    }

    /**
     * @return TRUE if the cache is empty
     */
    public boolean isEmpty() {
        return this.cache.isEmpty();
    }

    /**
     * @return a JSON object containing the cache
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        for (var mediaEntry : this.cache.entrySet()) {
            JsonObject mediaJson = new JsonObject();
            for (var objEntry : mediaEntry.getValue().entrySet()) {
                JsonObject objJson = new JsonObject();
                for (var threshEntry : objEntry.getValue().entrySet()) {
                    JsonObject threshJson = new JsonObject();
                    for (var rxnEntry : threshEntry.getValue().entrySet()) {
                        JsonObject rxnJson = new JsonObject();
                        for (var dirEntry : rxnEntry.getValue().entrySet())
                            rxnJson.put(dirEntry.getKey().getSymbol(), dirEntry.getValue().toJson());
                        threshJson.put(rxnEntry.getKey(), rxnJson);
                    }
                    objJson.put(threshEntry.getKey().toString(), threshJson);
                }
                mediaJson.put(objEntry.getKey(), objJson);
            }
            retVal.put(mediaEntry.getKey(), mediaJson);
        }
        return retVal;
    }

    /**
     * Create a filter cache from a JSON object.
     *
     * @param json		JSON object produced by {@link #toJson()}
     *
     * @return the filter cache described by the object
     *
     * @throws IllegalArgumentException		if the object is malformed
     */
    public static FilterCache fromJson(JsonObject json) {
        FilterCache retVal = new FilterCache();
        try {
            for (var mediaEntry : json.entrySet()) {
                JsonObject mediaJson = (JsonObject) mediaEntry.getValue();
                for (var objEntry : mediaJson.entrySet()) {
                    JsonObject objJson = (JsonObject) objEntry.getValue();
                    for (var threshEntry : objJson.entrySet()) {
                        double threshold = Double.parseDouble(threshEntry.getKey());
                        JsonObject threshJson = (JsonObject) threshEntry.getValue();
                        for (var rxnEntry : threshJson.entrySet()) {
                            JsonObject rxnJson = (JsonObject) rxnEntry.getValue();
                            for (var dirEntry : rxnJson.entrySet()) {
                                Direction dir = Direction.parse(dirEntry.getKey());
                                FilterRecord record = FilterRecord.fromJson((JsonObject) dirEntry.getValue());
                                retVal.record(mediaEntry.getKey(), objEntry.getKey(), threshold, rxnEntry.getKey(),
                                        dir, record);
                            }
                        }
                    }
                }
            }
        } catch (ClassCastException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid filter cache structure: " + e.getMessage());
        }
        return retVal;
    }

}

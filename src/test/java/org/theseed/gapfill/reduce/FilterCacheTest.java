/**
 *
 */
package org.theseed.gapfill.reduce;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.theseed.gapfill.conditions.TestCondition;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.model.Media;

import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * Tests for the filter cache.
 */
public class FilterCacheTest {

    @Test
    public void testRecordAndJson() throws JsonException {
        FilterCache cache = new FilterCache();
        assertThat(cache.isEmpty(), equalTo(true));
        TestCondition cond = TestCondition.growth(new Media("glc"), "bio1", 0.01);
        CandidateReaction r1 = new CandidateReaction("rxn1", Direction.FORWARD);
        r1.setOriginalBound(1000.0);
        r1.setScore(3.5);
        cache.record(cond, r1);
        // Existing records are kept.
        cache.record("glc", "bio1", 0.01, "rxn1", Direction.FORWARD, new FilterCache.FilterRecord(1.0, 1.0));
        cache.record("glc", "bio1", 0.01, "rxn1", Direction.REVERSE, new FilterCache.FilterRecord(-1000.0, Double.NaN));
        cache.record("ace", "bio1", 0.5, "rxn2", Direction.FORWARD, new FilterCache.FilterRecord(50.0, 0.0));
        assertThat(cache.size(), equalTo(3));
        assertThat(cache.contains(cond, r1), equalTo(true));
        assertThat(cache.contains(TestCondition.growth(new Media("glc"), "bio1", 0.02), r1), equalTo(false));
        String jsonString = Jsoner.serialize(cache.toJson());
        FilterCache cache2 = FilterCache.fromJson((JsonObject) Jsoner.deserialize(jsonString));
        assertThat(cache2.size(), equalTo(3));
        FilterCache.FilterRecord record = cache2.getFiltered(cond).get("rxn1").get(Direction.FORWARD);
        assertThat(record.getOriginalBound(), equalTo(1000.0));
        assertThat(record.getScore(), equalTo(3.5));
        record = cache2.getFiltered(cond).get("rxn1").get(Direction.REVERSE);
        assertThat(record.getOriginalBound(), equalTo(-1000.0));
        assertThat(Double.isNaN(record.getScore()), equalTo(true));
        assertThat(cache2.getFiltered(TestCondition.growth(new Media("ace"), "bio1", 0.5)).keySet(), contains("rxn2"));
    }

    @Test
    public void testMerge() {
        FilterCache cache = new FilterCache();
        cache.record("glc", "bio1", 0.01, "rxn1", Direction.FORWARD, new FilterCache.FilterRecord(1000.0, 1.0));
        FilterCache other = new FilterCache();
        other.record("glc", "bio1", 0.01, "rxn1", Direction.FORWARD, new FilterCache.FilterRecord(5.0, 5.0));
        other.record("glc", "bio1", 0.01, "rxn2", Direction.FORWARD, new FilterCache.FilterRecord(5.0, 5.0));
        cache.merge(other);
        assertThat(cache.size(), equalTo(2));
        TestCondition cond = TestCondition.growth(new Media("glc"), "bio1", 0.01);
        assertThat(cache.getFiltered(cond).get("rxn1").get(Direction.FORWARD).getOriginalBound(), equalTo(1000.0));
        assertThat(cache.getFiltered(cond).get("rxn2").get(Direction.FORWARD).getScore(), equalTo(5.0));
    }

    @Test
    public void testBadJson() throws JsonException {
        JsonObject json = (JsonObject) Jsoner.deserialize("{\"glc\": {\"bio1\": {\"abc\": {}}}}");
        assertThrows(IllegalArgumentException.class, () -> FilterCache.fromJson(json));
        JsonObject json2 = (JsonObject) Jsoner.deserialize("{\"glc\": [1, 2]}");
        assertThrows(IllegalArgumentException.class, () -> FilterCache.fromJson(json2));
    }

}

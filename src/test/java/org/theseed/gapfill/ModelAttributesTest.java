/**
 *
 */
package org.theseed.gapfill;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.gapfill.model.Direction;
import org.theseed.gapfill.reduce.FilterCache;

/**
 * Tests for saving and loading model attributes.
 */
public class ModelAttributesTest {

    @TempDir
    File tempDir;

    @Test
    public void testSaveLoad() throws IOException {
        ModelAttributes attributes = new ModelAttributes();
        attributes.getFilterCache().record("glc", "bio1", 0.01, "rxn00001_c0", Direction.REVERSE,
                new FilterCache.FilterRecord(-1000.0, 2.5));
        SensitivityReport report = attributes.getSensitivity();
        report.recordDatabaseFailure("ace", "bio1", true, List.of("cpd00001_c0", "cpd00002_c0"));
        report.recordDatabaseFailure("ace", "bio1", false, null);
        report.recordSuccess("glc", "bio1", "rxn00002_c0", Direction.FORWARD, List.of("cpd00003_c0"));
        report.recordSuccess("glc", "bio1", "rxn00003_c0", Direction.REVERSE, null);
        report.recordFailure("lac", "bio1");
        File outFile = new File(this.tempDir, "attributes.json");
        attributes.save(outFile);
        ModelAttributes loaded = ModelAttributes.load(outFile);
        assertThat(loaded.getFilterCache().size(), equalTo(1));
        SensitivityReport loadedReport = loaded.getSensitivity();
        assertThat(loadedReport.getMediaIds(), contains("ace", "glc", "lac"));
        SensitivityReport.Entry entry = loadedReport.getEntry("ace", "bio1");
        assertThat(entry.getBeforeFiltering(), contains("cpd00001_c0", "cpd00002_c0"));
        assertThat(entry.getAfterFiltering(), empty());
        assertThat(entry.getSuccess(), nullValue());
        entry = loadedReport.getEntry("glc", "bio1");
        assertThat(entry.getSuccess().get("rxn00002_c0").get(Direction.FORWARD), contains("cpd00003_c0"));
        assertThat(entry.getSuccess().get("rxn00003_c0").get(Direction.REVERSE), empty());
        assertThat(entry.isFailure(), equalTo(false));
        assertThat(loadedReport.getEntry("lac", "bio1").isFailure(), equalTo(true));
        assertThat(loadedReport.getEntry("lac", "bio2"), nullValue());
        String json = FileUtils.readFileToString(outFile, StandardCharsets.UTF_8);
        assertThat(json, containsString(ModelAttributes.FILTER_KEY));
        assertThat(json, containsString(SensitivityReport.BEFORE_FILTERING));
    }

    @Test
    public void testEmpty() throws IOException {
        File outFile = new File(this.tempDir, "empty.json");
        new ModelAttributes().save(outFile);
        ModelAttributes loaded = ModelAttributes.load(outFile);
        assertThat(loaded.getFilterCache().isEmpty(), equalTo(true));
        assertThat(loaded.getSensitivity().isEmpty(), equalTo(true));
    }

    @Test
    public void testMalformed() throws IOException {
        File badFile = new File(this.tempDir, "bad.json");
        FileUtils.writeStringToFile(badFile, "{\"gf_filter\": [1, 2", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> ModelAttributes.load(badFile));
        FileUtils.writeStringToFile(badFile, "{\"gf_sensitivity\": {\"glc\": 5}}", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> ModelAttributes.load(badFile));
        FileUtils.writeStringToFile(badFile, "[1, 2]", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> ModelAttributes.load(badFile));
    }

}

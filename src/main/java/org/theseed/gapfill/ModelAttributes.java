/**
 *
 */
package org.theseed.gapfill;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gapfill.reduce.FilterCache;

import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object holds the side data accumulated by gapfilling runs against a model:  the filter cache
 * from database prefiltering and the biomass sensitivity report.  The attributes can be saved to and
 * loaded from a JSON file.
 */
public class ModelAttributes {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelAttributes.class);
    /** cache of filtered gapfilling reactions */
    private FilterCache filterCache;
    /** biomass sensitivity report */
    private SensitivityReport sensitivity;

    /** JSON key for the filter cache */
    public static final String FILTER_KEY = "gf_filter";
    /** JSON key for the sensitivity report */
    public static final String SENSITIVITY_KEY = "gf_sensitivity";

    /**
     * Construct an empty attribute set.
     */
    public ModelAttributes() {
        this.filterCache = new FilterCache();
        this.sensitivity = new SensitivityReport();
    }

    /**
     * @return the filter cache
     */
    public FilterCache getFilterCache() {
        return this.filterCache;
    }

    /**
     * @return the sensitivity report
     */
    public SensitivityReport getSensitivity() {
        return this.sensitivity;
    }

    /**
     * @return a JSON object containing the attributes
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(FILTER_KEY, this.filterCache.toJson());
        retVal.put(SENSITIVITY_KEY, this.sensitivity.toJson());
        return retVal;
    }

    /**
     * Save the attributes to a file.
     *
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void save(File outFile) throws IOException {
        String jsonString = Jsoner.prettyPrint(this.toJson().toJson());
        FileUtils.writeStringToFile(outFile, jsonString, StandardCharsets.UTF_8);
        log.info("Model attributes saved to {}.", outFile);
    }

    /**
     * Load attributes from a file.
     *
     * @param inFile	input file
     *
     * @return the attributes read
     *
     * @throws IOException
     */
    public static ModelAttributes load(File inFile) throws IOException {
        ModelAttributes retVal = new ModelAttributes();
        String jsonString = FileUtils.readFileToString(inFile, StandardCharsets.UTF_8);
        try {
            JsonObject json = (JsonObject) Jsoner.deserialize(jsonString);
            JsonObject filterJson = (JsonObject) json.get(FILTER_KEY);
            if (filterJson != null)
                retVal.filterCache = FilterCache.fromJson(filterJson);
            JsonObject sensitivityJson = (JsonObject) json.get(SENSITIVITY_KEY);
            if (sensitivityJson != null)
                retVal.sensitivity = SensitivityReport.fromJson(sensitivityJson);
        } catch (JsonException | ClassCastException | IllegalArgumentException e) {
            throw new IOException("JSON error in " + inFile + ":" + e.toString());
        }
        log.info("Model attributes loaded from {}.", inFile);
        return retVal;
    }

}

/**
 *
 */
package org.theseed.gapfill;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.kohsuke.args4j.CmdLineException;

/**
 * Tests for gapfilling parameters and integration policies.
 */
public class GapfillParmsTest {

    @Test
    public void testDefaults() throws CmdLineException {
        GapfillParms parms = GapfillParms.parse();
        assertThat(parms.getMode(), equalTo(IntegrationPolicy.SEQUENTIAL));
        assertThat(parms.getMinObjective(), equalTo(0.01));
        assertThat(parms.getTarget(), equalTo("bio1"));
        assertThat(parms.isBinaryCheck(), equalTo(false));
        assertThat(parms.isPrefilter(), equalTo(true));
        assertThat(parms.isCheckForGrowth(), equalTo(true));
        assertThat(parms.isSensitivity(), equalTo(false));
        assertThat(parms.isIntegrate(), equalTo(true));
        assertThat(parms.isRemoveUnneeded(), equalTo(true));
        assertThat(parms.isBinarySearch(), equalTo(true));
    }

    @Test
    public void testOptions() throws CmdLineException {
        GapfillParms parms = GapfillParms.parse("--mode", "Global", "--minObj", "0.5", "--target", "bio2", "--binary",
                "--noPrefilter", "--noGrowthCheck", "--sensitivity", "--noIntegrate", "--keepUnneeded", "--linear");
        assertThat(parms.getMode(), equalTo(IntegrationPolicy.GLOBAL));
        assertThat(parms.getMinObjective(), equalTo(0.5));
        assertThat(parms.getTarget(), equalTo("bio2"));
        assertThat(parms.isBinaryCheck(), equalTo(true));
        assertThat(parms.isPrefilter(), equalTo(false));
        assertThat(parms.isCheckForGrowth(), equalTo(false));
        assertThat(parms.isSensitivity(), equalTo(true));
        assertThat(parms.isIntegrate(), equalTo(false));
        assertThat(parms.isRemoveUnneeded(), equalTo(false));
        assertThat(parms.isBinarySearch(), equalTo(false));
        parms = GapfillParms.parse("--mode", "cumulative");
        assertThat(parms.getMode(), equalTo(IntegrationPolicy.SEQUENTIAL));
        parms = GapfillParms.parse("--mode", "independent");
        assertThat(parms.getMode(), equalTo(IntegrationPolicy.INDEPENDENT));
    }

    @Test
    public void testInvalid() {
        assertThrows(CmdLineException.class, () -> GapfillParms.parse("--mode", "Parallel"));
        assertThrows(CmdLineException.class, () -> GapfillParms.parse("--minObj", "-1.0"));
        assertThrows(CmdLineException.class, () -> GapfillParms.parse("--bogus"));
        assertThrows(IllegalArgumentException.class, () -> IntegrationPolicy.parse("Parallel"));
    }

    @Test
    public void testSetters() {
        GapfillParms parms = new GapfillParms().setMode(IntegrationPolicy.INDEPENDENT).setRemoveUnneeded(false)
                .setBinarySearch(false).setMinObjective(0.2);
        assertThat(parms.getMode(), equalTo(IntegrationPolicy.INDEPENDENT));
        assertThat(parms.isRemoveUnneeded(), equalTo(false));
        assertThat(parms.isBinarySearch(), equalTo(false));
        assertThat(parms.getMinObjective(), equalTo(0.2));
        assertThat(IntegrationPolicy.GLOBAL.toString(), equalTo("Global"));
    }

}

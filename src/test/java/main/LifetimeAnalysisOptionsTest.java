package main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import analysis.lifetime.traversal.BlockCountTraversalPolicy;
import analysis.lifetime.traversal.FixedTraversalPolicy;
import analysis.lifetime.traversal.TraversalConfig;

import com.beust.jcommander.ParameterException;

public class LifetimeAnalysisOptionsTest {

    @Test
    public void testDefaults() {
        LifetimeAnalysisOptions o = LifetimeAnalysisOptions.getOptions(new String[0]);
        assertNull(o.getInputFile());
        assertEquals("tests", o.getOutputDir());
        assertEquals(TraversalConfig.DEFAULT, o.getTraversalConfig());
        assertTrue(o.getTraversalPolicy() instanceof FixedTraversalPolicy);
        assertEquals(1, o.getNumThreads());
        assertEquals(0, o.getOutputLevel());
        assertFalse(o.shouldWriteDot());
        assertFalse(o.shouldPrintUseage());
    }

    @Test
    public void testAllOptions() {
        LifetimeAnalysisOptions o = LifetimeAnalysisOptions.getOptions(new String[] { "-i", "fns.json", "-out", "out",
                "-k", "0", "-maxVisits", "5", "-policy", "blocks", "-numThreads", "3", "-o", "2", "-writeDot",
                "-releaseCallee", "free_a", "-releaseCallee", "free_b" });
        assertEquals("fns.json", o.getInputFile());
        assertEquals("out", o.getOutputDir());
        assertEquals(new TraversalConfig(0, 5), o.getTraversalConfig());
        assertTrue(o.getTraversalPolicy() instanceof BlockCountTraversalPolicy);
        assertEquals(3, o.getNumThreads());
        assertEquals(2, o.getOutputLevel());
        assertTrue(o.shouldWriteDot());
        assertEquals(Arrays.asList("free_a", "free_b"), o.getReleaseCallees());
        assertTrue(o.getCalleeClassifier().isExplicitRelease("pool::free_b"));
    }

    @Test(expected = ParameterException.class)
    public void testNegativeK() {
        LifetimeAnalysisOptions.getOptions(new String[] { "-k", "-1" });
    }

    @Test(expected = ParameterException.class)
    public void testZeroMaxVisits() {
        LifetimeAnalysisOptions.getOptions(new String[] { "-maxVisits", "0" });
    }

    @Test(expected = ParameterException.class)
    public void testUnknownPolicy() {
        LifetimeAnalysisOptions.getOptions(new String[] { "-policy", "adaptive" });
    }

    @Test(expected = ParameterException.class)
    public void testNotANumber() {
        LifetimeAnalysisOptions.getOptions(new String[] { "-numThreads", "many" });
    }

    @Test
    public void testUseageListsPolicies() {
        String useage = LifetimeAnalysisOptions.getUseage();
        assertTrue(useage.contains("-maxVisits"));
        assertTrue(useage.contains("blocks"));
    }
}

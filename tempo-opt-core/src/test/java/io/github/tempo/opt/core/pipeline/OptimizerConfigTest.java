package io.github.tempo.opt.core.pipeline;

import io.github.tempo.opt.core.analysis.CallProfile;
import io.github.tempo.opt.core.analysis.CostModel;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class OptimizerConfigTest {
    @Test
    void testDefaults() {
        OptimizerConfig config = OptimizerConfig.DEFAULT;
        assertEquals(10, config.getMaxOptimizationPasses());
        assertTrue(config.isPreserveWcetBounds());
        assertEquals(0.0, config.getMaxWcetDegradationPercent());
        assertTrue(config.isUnrollLoops());
        assertTrue(config.isInlineCalls());
        assertTrue(config.isReorderBranches());
        assertTrue(config.isGroupMemoryAccesses());
        assertEquals(4, config.getUnrollTripCountThreshold());
        assertEquals(32, config.getUnrollMaxBodySize());
        assertEquals(1L, config.getInlineCallFrequencyThreshold());
        assertEquals(64, config.getInlineMaxCalleeSize());
        assertSame(CostModel.DEFAULT, config.getCostModel());
        assertSame(CallProfile.EMPTY, config.getCallProfile());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().setMaxOptimizationPasses(0));
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().setMaxWcetDegradationPercent(-1));
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().setMaxWcetDegradationPercent(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().setUnrollTripCountThreshold(257));
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().setUnrollMaxBodySize(-1));
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().setInlineCallFrequencyThreshold(-1));
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().setCostModel(null));

        OptimizerConfig config = OptimizerConfig.builder()
                .setUnrollTripCountThreshold(256)
                .setMaxWcetDegradationPercent(12.5)
                .setInlineCalls(false)
                .build();
        assertEquals(256, config.getUnrollTripCountThreshold());
        assertEquals(12.5, config.getMaxWcetDegradationPercent());
        assertFalse(config.isInlineCalls());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("tempo.opt.maxOptimizationPasses", "3");
        properties.setProperty("tempo.opt.preserveWcetBounds", "FALSE");
        properties.setProperty("tempo.opt.maxWcetDegradationPercent", " 2.5 ");
        properties.setProperty("tempo.opt.inlineCallFrequencyThreshold", "100");
        properties.setProperty("maxOptimizationPasses", "7");
        OptimizerConfig config = OptimizerConfig.fromProperties(properties);
        assertEquals(3, config.getMaxOptimizationPasses());
        assertFalse(config.isPreserveWcetBounds());
        assertEquals(2.5, config.getMaxWcetDegradationPercent());
        assertEquals(100L, config.getInlineCallFrequencyThreshold());
        assertEquals(32, config.getUnrollMaxBodySize());
    }

    @Test
    void testMalformedProperties() {
        Properties properties = new Properties();
        properties.setProperty("tempo.opt.unrollLoops", "yes");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> OptimizerConfig.fromProperties(properties));
        assertEquals("malformed value for tempo.opt.unrollLoops: yes", e.getMessage());

        Properties outOfRange = new Properties();
        outOfRange.setProperty("tempo.opt.maxOptimizationPasses", "0");
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.fromProperties(outOfRange));

        Properties notANumber = new Properties();
        notANumber.setProperty("tempo.opt.inlineMaxCalleeSize", "big");
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.fromProperties(notANumber));
    }
}

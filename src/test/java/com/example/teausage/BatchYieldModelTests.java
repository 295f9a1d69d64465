package com.example.teausage;

import com.example.teausage.model.*;
import com.example.teausage.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class BatchYieldModelTests {
    private final BatchYieldModel model = new BatchYieldModel();

    @Test
    void reference_sample_matches_documented_numbers() {
        BatchYieldRecord r = model.compute(716141.0, 6504.0, 160.0, 600.0);
        assertEquals(110.11, r.batchesNeeded, 0.005);
        assertEquals(17617.24, r.leafGramsUsed, 0.005);
        assertEquals(29.36, r.bagsUsed, 0.005);
        // not rounded internally
        assertNotEquals(Math.round(r.batchesNeeded * 100) / 100.0, r.batchesNeeded);
    }

    @Test
    void zero_missing_or_negative_constants_are_configuration_errors() {
        assertThrows(ConfigurationException.class, () -> model.compute(1000.0, 0.0, 160.0, 600.0));
        assertThrows(ConfigurationException.class, () -> model.compute(1000.0, 6500.0, 0.0, 600.0));
        assertThrows(ConfigurationException.class, () -> model.compute(1000.0, 6500.0, 160.0, -1.0));
        BatchConstants noLeaf = new BatchConstants(6500.0, null, 600.0);
        assertThrows(ConfigurationException.class, () -> model.validate("green_tea", noLeaf));
        assertThrows(ConfigurationException.class, () -> model.batchYieldMl("green_tea", null));
    }

    @Test
    void yield_is_estimated_from_brew_inputs_when_not_given() {
        BatchConstants c = new BatchConstants();
        c.leafGramsPerBatch = 160.0;
        c.absorbMlPerG = 3.2;
        assertEquals(6488.0, model.batchYieldMl("four_seasons", c), 1e-9);

        c.processLossMl = 88.0;
        BatchYieldRecord r = model.compute("2025-02", "four_seasons", 28, 28, 64000.0, c);
        assertEquals(6400.0, r.batchYieldMl, 1e-9);
        assertEquals(10.0, r.batchesNeeded, 1e-9);
        assertEquals(1600.0, r.leafGramsUsed, 1e-9);
        assertEquals(1600.0 / 600.0, r.bagsUsed, 1e-9);
    }

    @Test
    void brew_estimate_requires_absorption_and_positive_result() {
        BatchConstants c = new BatchConstants();
        c.leafGramsPerBatch = 160.0;
        assertThrows(ConfigurationException.class, () -> model.batchYieldMl("x", c));
        c.absorbMlPerG = 50.0;
        assertThrows(ConfigurationException.class, () -> model.batchYieldMl("x", c));
    }

    @Test
    void zero_usage_gives_zero_batches() {
        BatchYieldRecord r = model.compute(0.0, 6504.0, 160.0, 600.0);
        assertEquals(0.0, r.batchesNeeded, 1e-12);
        assertEquals(0.0, r.bagsUsed, 1e-12);
        assertThrows(IllegalArgumentException.class, () -> model.compute(-1.0, 6504.0, 160.0, 600.0));
    }
}

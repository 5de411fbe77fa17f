package org.repcluster.clustering.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Clustering Exception Tests")
class ClusteringExceptionsTest {

    @Test
    @DisplayName("Configuration errors carry reason code, message prefix and cause")
    void testConfigurationException() {
        NumberFormatException cause = new NumberFormatException("x");
        ClusteringConfigurationException ex = new ClusteringConfigurationException("C0_TEST", "details", cause);

        assertEquals("C0_TEST", ex.reasonCode());
        assertEquals("[C0_TEST] details", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Data errors carry reason code and message prefix")
    void testDataException() {
        ClusteringDataException ex = new ClusteringDataException("C1_TEST", "series demand-X");

        assertEquals("C1_TEST", ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[C1_TEST] "));
    }

    @Test
    @DisplayName("Invariant violations are IllegalStateExceptions")
    void testInvariantException() {
        ClusteringInvariantException ex = new ClusteringInvariantException("C4_TEST", "row 3");

        assertTrue(ex instanceof IllegalStateException);
        assertEquals("C4_TEST", ex.reasonCode());
        assertEquals("[C4_TEST] row 3", ex.getMessage());
    }

    @Test
    @DisplayName("Blank reason codes are rejected")
    void testBlankReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ClusteringConfigurationException(" ", "d"));
        assertThrows(IllegalArgumentException.class, () -> new ClusteringDataException("", "d"));
        assertThrows(IllegalArgumentException.class, () -> new ClusteringInvariantException(" ", "d"));
    }
}

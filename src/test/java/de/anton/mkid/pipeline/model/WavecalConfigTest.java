package de.anton.mkid.pipeline.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WavecalConfigTest {

    @Test
    void histogramAttempts_shouldBeBounded() {
        WavecalConfig.Builder builder = WavecalConfig.defaults().toBuilder();

        assertEquals(WavecalConfig.MAX_HISTOGRAM_ATTEMPTS,
            builder.histogramAttempts(WavecalConfig.MAX_HISTOGRAM_ATTEMPTS).build().histogramAttempts());
        assertThrows(IllegalArgumentException.class, () -> builder.histogramAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> builder.histogramAttempts(WavecalConfig.MAX_HISTOGRAM_ATTEMPTS + 1).build());
        assertThrows(IllegalArgumentException.class, () -> builder.histogramAttempts(64).build());
    }

    @Test
    void fingerprintFields_shouldLeaveOutExecutionOptions() {
        WavecalConfig config = WavecalConfig.defaults();

        assertFalse(config.fingerprintFields().containsKey("parallel"));
        assertFalse(config.fingerprintFields().containsKey("summaryExport"));
        assertEquals(config.fingerprintFields(),
            config.toBuilder().parallel(!config.parallel()).summaryExport(true).build().fingerprintFields());
    }
}

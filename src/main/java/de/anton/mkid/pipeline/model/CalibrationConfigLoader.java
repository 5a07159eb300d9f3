package de.anton.mkid.pipeline.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the step configurations from a JSON document of the form
 * <pre>
 * { "wavecal": { "histogramBinWidth": 0.002, ... },
 *   "flatcal": { "chunkTimeSeconds": 10, ... } }
 * </pre>
 * Missing sections and keys keep their defaults; unknown keys are logged and ignored.
 */
public class CalibrationConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationConfigLoader.class);

    private static final Set<String> WAVECAL_KEYS = Set.of("version", "histogramBinWidth", "minimumPeakCounts",
        "histogramAttempts", "deadTimeMicros", "hotPixelRateCutoff", "modelOrder", "maxReducedChiSquared",
        "maxIterations", "parallel", "summaryExport");
    private static final Set<String> FLATCAL_KEYS = Set.of("version", "chunkTimeSeconds", "maxChunks",
        "wavelengthStartNm", "wavelengthStopNm", "wavelengthBinWidthNm", "rateCutoff", "trimFraction",
        "parallel", "summaryExport");

    /** Both step configurations of one reduction. */
    public record Configs(WavecalConfig wavecal, FlatcalConfig flatcal) { }

    public Configs load(Path file) throws IOException {
        Objects.requireNonNull(file, "Configuration file cannot be null.");
        logger.info("Loading calibration configuration from {}", file);
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws IOException if the document is not valid JSON
     * @throws IllegalArgumentException if a value is out of range
     */
    public Configs parse(String json) throws IOException {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new IOException("Calibration configuration must be a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Invalid calibration configuration: " + e.getMessage(), e);
        }
        for (String key : root.keySet()) {
            if (CalibrationKind.fromStepName(key) == null) {
                logger.warn("Ignoring unknown configuration section '{}'.", key);
            }
        }
        WavecalConfig wavecal = wavecal(section(root, CalibrationKind.WAVECAL));
        FlatcalConfig flatcal = flatcal(section(root, CalibrationKind.FLATCAL));
        logger.debug("Loaded {} and {}", wavecal, flatcal);
        return new Configs(wavecal, flatcal);
    }

    private static JsonObject section(JsonObject root, CalibrationKind kind) throws IOException {
        JsonElement e = root.get(kind.stepName());
        if (e == null || e.isJsonNull()) {
            return new JsonObject();
        }
        if (!e.isJsonObject()) {
            throw new IOException("Section '" + kind.stepName() + "' must be a JSON object");
        }
        return e.getAsJsonObject();
    }

    static WavecalConfig wavecal(JsonObject o) throws IOException {
        warnUnknown(o, WAVECAL_KEYS, CalibrationKind.WAVECAL);
        WavecalConfig d = WavecalConfig.defaults();
        try {
            return WavecalConfig.builder()
                .version(getInt(o, "version", d.version()))
                .histogramBinWidth(getDouble(o, "histogramBinWidth", d.histogramBinWidth()))
                .minimumPeakCounts(getInt(o, "minimumPeakCounts", d.minimumPeakCounts()))
                .histogramAttempts(getInt(o, "histogramAttempts", d.histogramAttempts()))
                .deadTimeMicros(getLong(o, "deadTimeMicros", d.deadTimeMicros()))
                .hotPixelRateCutoff(getDouble(o, "hotPixelRateCutoff", d.hotPixelRateCutoff()))
                .modelOrder(getInt(o, "modelOrder", d.modelOrder()))
                .maxReducedChiSquared(getDouble(o, "maxReducedChiSquared", d.maxReducedChiSquared()))
                .maxIterations(getInt(o, "maxIterations", d.maxIterations()))
                .parallel(getBoolean(o, "parallel", d.parallel()))
                .summaryExport(getBoolean(o, "summaryExport", d.summaryExport()))
                .build();
        } catch (ClassCastException | IllegalStateException | NumberFormatException e) {
            throw new IOException("Invalid value in wavecal configuration: " + e.getMessage(), e);
        }
    }

    static FlatcalConfig flatcal(JsonObject o) throws IOException {
        warnUnknown(o, FLATCAL_KEYS, CalibrationKind.FLATCAL);
        FlatcalConfig d = FlatcalConfig.defaults();
        try {
            return FlatcalConfig.builder()
                .version(getInt(o, "version", d.version()))
                .chunkTimeSeconds(getDouble(o, "chunkTimeSeconds", d.chunkTimeSeconds()))
                .maxChunks(getInt(o, "maxChunks", d.maxChunks()))
                .wavelengthStartNm(getDouble(o, "wavelengthStartNm", d.wavelengthStartNm()))
                .wavelengthStopNm(getDouble(o, "wavelengthStopNm", d.wavelengthStopNm()))
                .wavelengthBinWidthNm(getDouble(o, "wavelengthBinWidthNm", d.wavelengthBinWidthNm()))
                .rateCutoff(getDouble(o, "rateCutoff", d.rateCutoff()))
                .trimFraction(getDouble(o, "trimFraction", d.trimFraction()))
                .parallel(getBoolean(o, "parallel", d.parallel()))
                .summaryExport(getBoolean(o, "summaryExport", d.summaryExport()))
                .build();
        } catch (ClassCastException | IllegalStateException | NumberFormatException e) {
            throw new IOException("Invalid value in flatcal configuration: " + e.getMessage(), e);
        }
    }

    private static void warnUnknown(JsonObject o, Set<String> known, CalibrationKind kind) {
        for (String key : o.keySet()) {
            if (!known.contains(key)) {
                logger.warn("Ignoring unknown {} configuration key '{}'.", kind.stepName(), key);
            }
        }
    }

    private static boolean present(JsonObject o, String key) {
        return o.has(key) && !o.get(key).isJsonNull();
    }

    private static int getInt(JsonObject o, String key, int fallback) {
        return present(o, key) ? o.get(key).getAsInt() : fallback;
    }

    private static long getLong(JsonObject o, String key, long fallback) {
        return present(o, key) ? o.get(key).getAsLong() : fallback;
    }

    private static double getDouble(JsonObject o, String key, double fallback) {
        return present(o, key) ? o.get(key).getAsDouble() : fallback;
    }

    private static boolean getBoolean(JsonObject o, String key, boolean fallback) {
        return present(o, key) ? o.get(key).getAsBoolean() : fallback;
    }
}

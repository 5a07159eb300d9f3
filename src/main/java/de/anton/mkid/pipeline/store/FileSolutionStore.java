package de.anton.mkid.pipeline.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import de.anton.mkid.pipeline.model.CalibrationKind;
import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.Fingerprint;
import de.anton.mkid.pipeline.model.FlatSolution;
import de.anton.mkid.pipeline.model.WavelengthSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Solution store keeping one JSON file per fingerprint in a directory.
 * <p>
 * The file name is {@link Fingerprint#key()} plus {@code .json}, so candidate
 * artifacts are filtered by name before any file is parsed, and two writers
 * of the same fingerprint target the same file. Writes go to a temporary
 * sibling which is then moved over the target atomically.
 */
public class FileSolutionStore implements SolutionStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSolutionStore.class);

    static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final Gson gson;

    public FileSolutionStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Store directory cannot be null.");
        this.gson = new GsonBuilder()
            .serializeSpecialFloatingPointValues() // undefined weights are NaN
            .setPrettyPrinting()
            .create();
    }

    public Path getDirectory() {
        return directory;
    }

    /** Artifact path for a fingerprint. */
    public Path pathOf(Fingerprint fingerprint) {
        return directory.resolve(fingerprint.key() + EXTENSION);
    }

    @Override
    public Optional<CalibrationSolution> find(Fingerprint query) throws SolutionStoreException {
        Objects.requireNonNull(query, "query");
        if (!Files.isDirectory(directory)) {
            logger.debug("Store directory {} does not exist yet, nothing stored.", directory);
            return Optional.empty();
        }
        List<Path> candidates = listCandidates(query.keyPrefix());
        logger.debug("{} candidate artifact(s) for {} in {}.", candidates.size(), query, directory);

        List<CalibrationSolution> compatible = new ArrayList<>();
        for (Path file : candidates) {
            Optional<CalibrationSolution> solution = read(file, query.kind());
            if (solution.isEmpty()) {
                continue;
            }
            CalibrationSolution s = solution.get();
            if (s.getFingerprint().equals(query)) {
                logger.debug("Exact match {}.", file.getFileName());
                return solution;
            }
            if (s.getFingerprint().isCompatibleWith(query)) {
                compatible.add(s);
            }
        }
        return compatible.stream()
            .max(Comparator.comparingLong((CalibrationSolution s) -> s.getProvenance().createdAtMillis())
                .thenComparing(CalibrationSolution::getSolutionId));
    }

    private List<Path> listCandidates(String prefix) throws SolutionStoreException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(p -> {
                    String name = p.getFileName().toString();
                    return name.startsWith(prefix) && name.endsWith(EXTENSION);
                })
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SolutionStoreException("Cannot list solution store " + directory, e);
        }
    }

    /**
     * Reads one artifact. Unreadable or corrupt files are logged and skipped;
     * another fit will replace them.
     */
    Optional<CalibrationSolution> read(Path file, CalibrationKind kind) {
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(revalidate(deserialize(json, kind)));
        } catch (IOException e) {
            logger.warn("Skipping unreadable solution artifact {}: {}", file, e.getMessage());
        } catch (JsonParseException | IllegalArgumentException e) {
            logger.warn("Skipping corrupt solution artifact {}: {}", file, e.getMessage());
        }
        return Optional.empty();
    }

    private CalibrationSolution deserialize(String json, CalibrationKind kind) {
        JsonElement root = JsonParser.parseString(json);
        if (!root.isJsonObject()) {
            throw new JsonParseException("Solution artifact is not a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        boolean wavecal = kind == CalibrationKind.WAVECAL;
        requireMembers(object, "solutionId", "fingerprint", "provenance", "config", "pixels",
            wavecal ? "referenceWavelengthsNm" : "binEdgesNm");
        if (!object.get("pixels").isJsonArray()) {
            throw new JsonParseException("Solution artifact member 'pixels' is not an array");
        }
        for (JsonElement pixel : object.getAsJsonArray("pixels")) {
            if (!pixel.isJsonObject()) {
                throw new JsonParseException("Solution artifact holds a pixel that is not an object");
            }
        }
        Class<? extends CalibrationSolution> type = wavecal ? WavelengthSolution.class : FlatSolution.class;
        try {
            return gson.fromJson(object, type);
        } catch (JsonParseException e) {
            throw e;
        } catch (RuntimeException e) {
            // Gson reports a record constructor that rejects its values as a bare RuntimeException
            throw new JsonParseException("Solution artifact does not describe a valid solution: " + e.getMessage(), e);
        }
    }

    private static void requireMembers(JsonObject object, String... names) {
        for (String name : names) {
            if (!object.has(name) || object.get(name).isJsonNull()) {
                throw new JsonParseException("Solution artifact lacks '" + name + "'");
            }
        }
    }

    /** Rebuilds the solution through its constructor so the usual invariants hold. */
    private static CalibrationSolution revalidate(CalibrationSolution raw) {
        CalibrationSolution rebuilt;
        if (raw instanceof WavelengthSolution) {
            WavelengthSolution w = (WavelengthSolution) raw;
            rebuilt = new WavelengthSolution(w.getFingerprint(), w.getProvenance(), w.getConfig(),
                w.getReferenceWavelengthsNm(), w.getPixels());
        } else {
            FlatSolution f = (FlatSolution) raw;
            rebuilt = new FlatSolution(f.getFingerprint(), f.getProvenance(), f.getConfig(),
                f.getBinEdgesNm(), f.getPixels());
        }
        if (!rebuilt.getSolutionId().equals(raw.getSolutionId())) {
            throw new IllegalArgumentException("Stored id " + raw.getSolutionId()
                + " does not match its fingerprint " + rebuilt.getSolutionId());
        }
        return rebuilt;
    }

    @Override
    public void put(CalibrationSolution solution) throws SolutionStoreException {
        Objects.requireNonNull(solution, "solution");
        Path target = pathOf(solution.getFingerprint());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, solution.getSolutionId() + "-", TEMP_SUFFIX);
            Files.writeString(temp, gson.toJson(solution), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, falling back to replace.", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Stored solution {} ({} usable of {} pixels) at {}.", solution.getSolutionId(),
                solution.getUsablePixelCount(), solution.getPixelCount(), target);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to store solution {} in {}", solution.getSolutionId(), directory, e);
            deleteQuietly(temp);
            throw new SolutionStoreException("Cannot store solution " + solution.getSolutionId(), e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}

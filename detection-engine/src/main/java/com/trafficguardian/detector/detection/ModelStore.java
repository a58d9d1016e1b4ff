package com.trafficguardian.detector.detection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficguardian.detector.config.ModelStoreConfig;
import com.trafficguardian.detector.error.NotReadyException;
import com.trafficguardian.detector.feature.FeatureTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Versioned on-disk storage of the detector's model set.
 *
 * <pre>
 * &lt;root&gt;/
 *   current.json                 manifest naming the version in force
 *   v&lt;N&gt;/scaler.json             feature transformer
 *   v&lt;N&gt;/isolation_forest.bin     Model A
 *   v&lt;N&gt;/local_outlier_factor.bin Model B
 * </pre>
 *
 * <p>
 * A new set is written into a fresh version directory first; the manifest is
 * then replaced by an atomic move, so readers see either the old set or the
 * new one, never a mix.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class ModelStore {

    private static final Logger log = LoggerFactory.getLogger(ModelStore.class);

    static final String MANIFEST = "current.json";
    static final String SCALER = "scaler.json";
    static final String ISOLATION_FOREST_BLOB = "isolation_forest.bin";
    static final String LOF_BLOB = "local_outlier_factor.bin";

    private static final Pattern VERSION_DIR = Pattern.compile("v(\\d+)");

    /** Contents of {@code current.json}. */
    record Manifest(long version, String directory, Instant trainedAt, double contamination, int samples,
            int featureCount) {
    }

    private final Path root;
    private final int retainedVersions;
    private final ObjectMapper objectMapper;

    @Autowired
    public ModelStore(ModelStoreConfig config, ObjectMapper objectMapper) {
        this(Path.of(config.getPath()), config.getRetainedVersions(), objectMapper);
    }

    public ModelStore(Path root, int retainedVersions, ObjectMapper objectMapper) {
        this.root = root;
        this.retainedVersions = Math.max(1, retainedVersions);
        this.objectMapper = objectMapper;
    }

    /** Next unused version number. */
    public long nextVersion() {
        return versionDirectories().stream().mapToLong(ModelStore::versionOf).max().orElse(0L) + 1;
    }

    /**
     * Persist a complete model set and make it current.
     *
     * @throws UncheckedIOException if any part cannot be written; the previous
     *                              set stays current
     */
    public void save(DetectorState state) {
        String directoryName = "v" + state.version();
        Path directory = root.resolve(directoryName);
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(directory.resolve(SCALER).toFile(), state.transformer());
            writeBlob(directory.resolve(ISOLATION_FOREST_BLOB), state.isolationForest());
            writeBlob(directory.resolve(LOF_BLOB), state.lof());

            Manifest manifest = new Manifest(state.version(), directoryName, state.trainedAt(),
                    state.contamination(), state.samples(), state.transformer().featureCount());
            Path temp = root.resolve(MANIFEST + ".tmp");
            objectMapper.writeValue(temp.toFile(), manifest);
            moveIntoPlace(temp, root.resolve(MANIFEST));
        } catch (IOException e) {
            log.error("Failed to persist model set version {} to {}", state.version(), directory, e);
            throw new UncheckedIOException("Cannot persist model set version " + state.version(), e);
        }
        log.info("Persisted model set version {} to {}", state.version(), directory);
        prune(state.version());
    }

    /**
     * Load the current model set.
     *
     * @return empty when nothing was ever saved
     * @throws NotReadyException if the manifest names a set with missing or
     *                           unreadable parts
     */
    public Optional<DetectorState> load() {
        Path manifestFile = root.resolve(MANIFEST);
        if (!Files.isRegularFile(manifestFile)) {
            return Optional.empty();
        }
        try {
            Manifest manifest = objectMapper.readValue(manifestFile.toFile(), Manifest.class);
            Path directory = root.resolve(manifest.directory());
            FeatureTransformer transformer = objectMapper.readValue(
                    requirePart(directory.resolve(SCALER)).toFile(), FeatureTransformer.class);
            IsolationForestModel isolationForest = readBlob(
                    requirePart(directory.resolve(ISOLATION_FOREST_BLOB)), IsolationForestModel.class);
            LocalOutlierFactorModel lof = readBlob(requirePart(directory.resolve(LOF_BLOB)),
                    LocalOutlierFactorModel.class);
            log.info("Loaded model set version {} trained at {}", manifest.version(), manifest.trainedAt());
            return Optional.of(new DetectorState(manifest.version(), manifest.trainedAt(), transformer,
                    isolationForest, lof, manifest.contamination(), manifest.samples()));
        } catch (IOException | ClassNotFoundException e) {
            throw new NotReadyException("Persisted model set under " + root + " is unreadable", e);
        }
    }

    public Path root() {
        return root;
    }

    private static Path requirePart(Path part) {
        if (!Files.isRegularFile(part)) {
            throw new NotReadyException("Persisted model part missing: " + part);
        }
        return part;
    }

    private static void writeBlob(Path file, Serializable model) throws IOException {
        try (OutputStream out = Files.newOutputStream(file);
                ObjectOutputStream oos = new ObjectOutputStream(out)) {
            oos.writeObject(model);
        }
    }

    private static <T> T readBlob(Path file, Class<T> type) throws IOException, ClassNotFoundException {
        try (InputStream in = Files.newInputStream(file);
                ObjectInputStream ois = new ObjectInputStream(in)) {
            Object model = ois.readObject();
            if (!type.isInstance(model)) {
                throw new NotReadyException("Unexpected model type in " + file + ": " + model.getClass().getName());
            }
            return type.cast(model);
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported under {}, replacing manifest non-atomically", target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void prune(long currentVersion) {
        List<Path> stale = versionDirectories().stream()
                .sorted(Comparator.comparingLong(ModelStore::versionOf).reversed())
                .skip(retainedVersions)
                .filter(dir -> versionOf(dir) != currentVersion)
                .toList();
        for (Path dir : stale) {
            try (Stream<Path> walk = Files.walk(dir)) {
                for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(path);
                }
                log.debug("Pruned model set {}", dir.getFileName());
            } catch (IOException e) {
                log.warn("Failed to prune old model set {}: {}", dir, e.getMessage());
            }
        }
    }

    private List<Path> versionDirectories() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(root)) {
            return entries.filter(Files::isDirectory)
                    .filter(dir -> VERSION_DIR.matcher(dir.getFileName().toString()).matches())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list model versions under " + root, e);
        }
    }

    private static long versionOf(Path dir) {
        Matcher matcher = VERSION_DIR.matcher(dir.getFileName().toString());
        return matcher.matches() ? Long.parseLong(matcher.group(1)) : 0L;
    }
}

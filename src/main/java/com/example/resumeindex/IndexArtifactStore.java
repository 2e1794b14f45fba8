package com.example.resumeindex;

import com.github.jelmerk.knn.bruteforce.BruteForceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the directory of immutable index artifacts: naming, atomic writes, loading and listing.
 * <p>
 * Artifact names are {@code resume_profiles_yyyyMMdd'T'HHmmss'Z'.idx}, so lexical and chronological
 * order agree.
 */
@Service
public class IndexArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(IndexArtifactStore.class);

    static final String PREFIX = "resume_profiles_";
    static final String SUFFIX = ".idx";
    static final Pattern ARTIFACT_NAME = Pattern.compile("resume_profiles_\\d{8}T\\d{6}Z\\.idx");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final Path indexDir;
    private final Clock clock;

    public IndexArtifactStore(@Value("${index.dir:./data/indexes}") String indexDir, Clock clock) {
        this.indexDir = Path.of(indexDir).toAbsolutePath().normalize();
        this.clock = clock;
    }

    public Path getIndexDir() {
        return indexDir;
    }

    /** The string stored in {@code index_artifact_path}; queries must normalize the same way. */
    public static String reference(Path artifact) {
        return artifact.toAbsolutePath().normalize().toString();
    }

    /**
     * Saves {@code index} under a fresh timestamped name. The file is written beside its final location,
     * the name is then claimed with an exclusive create and the finished file is moved onto it, so a
     * partially written artifact is never visible and an existing artifact is never overwritten.
     */
    public Path write(BruteForceIndex<Integer, float[], PositionItem, Float> index) {
        Path tmp = null;
        Path target = null;
        try {
            Files.createDirectories(indexDir);
            tmp = Files.createTempFile(indexDir, "." + PREFIX, ".tmp");
            index.save(tmp);
            target = reserveArtifactPath();
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Wrote index artifact {} ({} vectors)", target, index.size());
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            deleteQuietly(target, e);
            throw new UncheckedIOException("Failed to write index artifact into " + indexDir, e);
        }
    }

    private static void deleteQuietly(Path path, IOException failure) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    public BruteForceIndex<Integer, float[], PositionItem, Float> load(Path artifact) {
        if (artifact == null || !Files.isRegularFile(artifact)) {
            throw new NotFoundException("Index artifact not found: " + artifact);
        }
        try {
            return BruteForceIndex.load(artifact);
        } catch (IOException | RuntimeException e) {
            throw new ValidationException("Index artifact is unreadable: " + artifact + " (" + e.getMessage() + ")", e);
        }
    }

    /** Artifacts in the index directory, oldest first. */
    public List<Path> listArtifacts() {
        if (!Files.isDirectory(indexDir)) return new ArrayList<>();
        try (Stream<Path> files = Files.list(indexDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> ARTIFACT_NAME.matcher(p.getFileName().toString()).matches())
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list index artifacts in " + indexDir, e);
        }
    }

    public Path latest() {
        List<Path> all = listArtifacts();
        if (all.isEmpty()) {
            throw new NotFoundException("No index artifacts found in " + indexDir);
        }
        return all.get(all.size() - 1);
    }

    // claims the name atomically; advances one second at a time while a name is taken
    Path reserveArtifactPath() throws IOException {
        Instant stamp = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        while (true) {
            Path candidate = indexDir.resolve(PREFIX + STAMP.format(stamp) + SUFFIX);
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException taken) {
                stamp = stamp.plusSeconds(1);
            }
        }
    }
}

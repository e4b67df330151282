package com.manifold.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.Finding;
import com.manifold.core.model.ResearchPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link RunStore} backed by a directory per run, one JSON file per artifact.
 * <p>
 * Each artifact is written to a temp file in the run directory and then renamed into place;
 * the rename refuses to overwrite, which enforces write-once per key.
 */
public class FileSystemRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRunStore.class);
    private static final String RUN_DIR_PREFIX = "run-";
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path root;
    private final ObjectMapper mapper;

    public FileSystemRunStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public FileSystemRunStore(Path root) {
        this(root, new ObjectMapper());
    }

    public Path runDirectory(String runId) {
        return root.resolve(RUN_DIR_PREFIX + checkKey(runId));
    }

    @Override
    public void writePlan(ResearchPlan plan) {
        write(plan.runId(), PLAN, plan);
    }

    @Override
    public Optional<ResearchPlan> readPlan(String runId) {
        return read(runId, PLAN, ResearchPlan.class);
    }

    @Override
    public void putFinding(String runId, Finding finding) {
        write(runId, FINDING_PREFIX + checkKey(finding.threadId()), finding);
    }

    @Override
    public Optional<Finding> readFinding(String runId, String threadId) {
        return read(runId, FINDING_PREFIX + checkKey(threadId), Finding.class);
    }

    @Override
    public void writeFinalOutput(FinalOutput output) {
        write(output.runId(), FINAL_OUTPUT, output);
    }

    @Override
    public Optional<FinalOutput> readFinalOutput(String runId) {
        return read(runId, FINAL_OUTPUT, FinalOutput.class);
    }

    @Override
    public List<String> listRunIds() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(root)) {
            var ids = new ArrayList<String>();
            dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.startsWith(RUN_DIR_PREFIX))
                    .map(name -> name.substring(RUN_DIR_PREFIX.length()))
                    .sorted()
                    .forEach(ids::add);
            return ids;
        } catch (IOException e) {
            throw new StorageException("Cannot list runs under " + root + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String runId) {
        return Files.isDirectory(runDirectory(runId));
    }

    @Override
    public String describe() {
        return "filesystem (" + root.toAbsolutePath().normalize() + ")";
    }

    private void write(String runId, String key, Object artifact) {
        Path dir = runDirectory(runId);
        Path target = dir.resolve(key);
        Path tmp = dir.resolve("." + key + ".tmp-" + UUID.randomUUID());
        try {
            Files.createDirectories(dir);
            mapper.writeValue(tmp.toFile(), artifact);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Cannot write " + key + " for run " + runId + ": " + e.getMessage(), e);
        }
        try {
            Files.move(tmp, target);
            log.debug("Wrote {} for run {} ({})", key, runId, target);
        } catch (FileAlreadyExistsException e) {
            deleteQuietly(tmp);
            throw new IllegalStateException("Artifact " + key + " already written for run " + runId);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Cannot commit " + key + " for run " + runId + ": " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> read(String runId, String key, Class<T> type) {
        Path file = runDirectory(runId).resolve(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StorageException("Cannot read " + key + " for run " + runId + ": " + e.getMessage(), e);
        }
    }

    private static String checkKey(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Unsafe artifact key: '" + key + "'");
        }
        return key;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}

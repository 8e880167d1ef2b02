package io.vulnscan.analysis.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

/**
 * Stores each run as {@code <dir>/<id>.json}, replaced atomically on every save.
 */
public class JsonFileRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRunStore.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonFileRunStore(Path directory) {
        this(directory, defaultMapper());
    }

    public JsonFileRunStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void save(RunRecord record) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(record.id());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), record);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Optional<RunRecord> find(String id) {
        Path file = fileFor(id);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), RunRecord.class));
        } catch (IOException e) {
            log.warn("Unreadable run record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<RunRecord> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<RunRecord> records = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (name.endsWith(".json")) {
                    find(name.substring(0, name.length() - ".json".length())).ifPresent(records::add);
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list runs in {}: {}", directory, e.getMessage());
        }
        records.sort(Comparator.comparing(RunRecord::startTime, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return records;
    }

    private Path fileFor(String id) {
        if (!id.matches("[A-Za-z0-9._-]+")) {
            throw new IllegalArgumentException("Invalid run id: " + id);
        }
        return directory.resolve(id + ".json");
    }
}

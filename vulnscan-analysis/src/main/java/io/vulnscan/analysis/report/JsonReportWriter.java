package io.vulnscan.analysis.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vulnscan.analysis.run.JsonFileRunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reports as {@code <dir>/analysis_<runId>.json}.
 */
public class JsonReportWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonReportWriter(Path directory) {
        this(directory, JsonFileRunStore.defaultMapper());
    }

    public JsonReportWriter(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    public Path write(AnalysisReport report) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve("analysis_" + report.run().id() + ".json");
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        log.info("Wrote report with {} findings to {}", report.findings().size(), file);
        return file;
    }

    public AnalysisReport read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), AnalysisReport.class);
    }
}

package com.purchasingpower.itemgraph.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Writes the end-of-run report as pretty-printed JSON to {@code itemgraph.report.output-path}.
 */
@Slf4j
@Service
public class ReportWriter {

    private final ItemGraphProperties properties;
    private final ObjectMapper objectMapper;

    public ReportWriter(ItemGraphProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return Path written, or empty when report output is disabled or the write failed
     */
    public Optional<Path> write(IngestionReport report) {
        String outputPath = properties.getReport().getOutputPath();
        if (outputPath == null || outputPath.isBlank()) {
            return Optional.empty();
        }

        Path path = Paths.get(outputPath);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), report);
            log.info("📄 Report for run {} written to {}", report.getRunId(), path.toAbsolutePath());
            return Optional.of(path);
        } catch (IOException e) {
            // the run outcome stands even when its report cannot be persisted
            log.error("❌ Failed to write report for run {} to {}", report.getRunId(), path, e);
            return Optional.empty();
        }
    }
}

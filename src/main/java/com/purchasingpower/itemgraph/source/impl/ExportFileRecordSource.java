package com.purchasingpower.itemgraph.source.impl;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import com.purchasingpower.itemgraph.configuration.SourceProperties;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RawRecord;
import com.purchasingpower.itemgraph.exception.RecordSourceException;
import com.purchasingpower.itemgraph.source.RecordSource;
import com.purchasingpower.itemgraph.util.CallContext;
import com.purchasingpower.itemgraph.util.ExternalCallLogger;
import com.purchasingpower.itemgraph.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the per-kind export documents from the configured data directory.
 *
 * <p>Each file holds one object whose single list sits under the file name's prefix,
 * e.g. {@code ExportWeapons_en.json} → {@code {"ExportWeapons": [...]}}. A missing
 * list reads as empty. Entries that are not objects are passed on as empty records
 * so the normalizer rejects them at their position.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ExportFileRecordSource implements RecordSource {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final ItemGraphProperties properties;
    private final ObjectMapper objectMapper;

    public ExportFileRecordSource(ItemGraphProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        // exports carry raw control characters inside description strings
        this.objectMapper = objectMapper.copy()
                .enable(JsonParser.Feature.ALLOW_UNQUOTED_CONTROL_CHARS);
    }

    @Override
    public Map<NodeKind, List<RawRecord>> read() {
        SourceProperties source = properties.getSource();
        Path dataDir = Paths.get(source.getDataDir());
        if (!Files.isDirectory(dataDir)) {
            throw new RecordSourceException(dataDir.toString(), "Export directory not found: " + dataDir.toAbsolutePath());
        }

        Map<NodeKind, List<RawRecord>> records = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            if (!kind.isIngested()) {
                continue;
            }
            String fileName = source.getFiles().get(kind);
            if (fileName == null || fileName.isBlank()) {
                log.warn("⚠️ No export file configured for {}, skipping", kind.getLabel());
                records.put(kind, List.of());
                continue;
            }
            records.put(kind, readFile(dataDir.resolve(fileName), rootKey(fileName)));
        }
        return records;
    }

    @Override
    public String describe() {
        return "export files in " + properties.getSource().getDataDir();
    }

    /**
     * {@code ExportWeapons_en.json} → {@code ExportWeapons}.
     */
    static String rootKey(String fileName) {
        String base = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        int underscore = base.indexOf('_');
        return underscore > 0 ? base.substring(0, underscore) : base;
    }

    private List<RawRecord> readFile(Path file, String rootKey) {
        if (!Files.isRegularFile(file)) {
            throw new RecordSourceException(file.toString(), "Export file not found: " + file.toAbsolutePath());
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.EXPORT_FILES, "read " + file.getFileName(), log);
        ctx.logRequest(file.toString());
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            ctx.logError(e.getMessage(), e);
            throw new RecordSourceException(file.toString(),
                    "Cannot parse " + file.getFileName() + ": " + ExternalCallLogger.truncate(e.getMessage(), 300), e);
        }

        JsonNode list = root != null ? root.get(rootKey) : null;
        if (list == null || !list.isArray()) {
            log.warn("⚠️ {} has no '{}' list, reading it as empty", file.getFileName(), rootKey);
            ctx.logResponse("0 records");
            return List.of();
        }

        List<RawRecord> records = new ArrayList<>(list.size());
        for (JsonNode entry : list) {
            if (entry.isObject()) {
                records.add(RawRecord.of(objectMapper.convertValue(entry, FIELDS)));
            } else {
                records.add(RawRecord.of(Map.of()));
            }
        }
        ctx.logResponse(records.size() + " records", "Key", rootKey);
        return records;
    }
}

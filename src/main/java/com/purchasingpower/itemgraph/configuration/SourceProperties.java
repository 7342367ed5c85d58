package com.purchasingpower.itemgraph.configuration;

import com.purchasingpower.itemgraph.core.NodeKind;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

@Data
public class SourceProperties {

    @NotBlank
    private String dataDir = "data_raw";

    /**
     * Export file per ingested kind. The top-level JSON key is the file name up to
     * the first underscore, e.g. {@code ExportWeapons}.
     */
    private Map<NodeKind, String> files = defaultFiles();

    private static Map<NodeKind, String> defaultFiles() {
        Map<NodeKind, String> files = new EnumMap<>(NodeKind.class);
        files.put(NodeKind.WEAPON, "ExportWeapons_en.json");
        files.put(NodeKind.RESOURCE, "ExportResources_en.json");
        files.put(NodeKind.RECIPE, "ExportRecipes_en.json");
        return files;
    }
}

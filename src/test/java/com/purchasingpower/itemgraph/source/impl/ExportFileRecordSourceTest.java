package com.purchasingpower.itemgraph.source.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RawRecord;
import com.purchasingpower.itemgraph.exception.RecordSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Export File Record Source Tests")
class ExportFileRecordSourceTest {

    @TempDir
    Path dataDir;

    private ItemGraphProperties properties;
    private ExportFileRecordSource source;

    @BeforeEach
    void setUp() {
        properties = new ItemGraphProperties();
        properties.getSource().setDataDir(dataDir.toString());
        source = new ExportFileRecordSource(properties, new ObjectMapper());
    }

    private void write(String fileName, String json) throws IOException {
        Files.writeString(dataDir.resolve(fileName), json, StandardCharsets.UTF_8);
    }

    private void writeAll() throws IOException {
        write("ExportWeapons_en.json", """
                {"ExportWeapons": [
                  {"uniqueName": "/Lotus/Weapons/W1", "name": "Braton", "masteryReq": 0, "damagePerShot": [1.5, 2]},
                  {"uniqueName": "/Lotus/Weapons/W2", "name": "Lato"}
                ]}
                """);
        write("ExportResources_en.json", """
                {"ExportResources": [{"uniqueName": "/Lotus/Types/R1", "name": "Ferrite"}]}
                """);
        write("ExportRecipes_en.json", """
                {"ExportRecipes": [
                  {"uniqueName": "/Lotus/Recipes/B1", "resultType": "/Lotus/Weapons/W1",
                   "ingredients": [{"ItemType": "/Lotus/Types/R1", "ItemCount": 5}]}
                ]}
                """);
    }

    @Test
    @DisplayName("Reads each export under its kind, records in file order")
    void testReadsAllKinds() throws IOException {
        writeAll();

        Map<NodeKind, List<RawRecord>> records = source.read();

        assertEquals(2, records.get(NodeKind.WEAPON).size());
        assertEquals(1, records.get(NodeKind.RESOURCE).size());
        assertEquals(1, records.get(NodeKind.RECIPE).size());
        assertFalse(records.containsKey(NodeKind.CATEGORY));
        assertEquals("/Lotus/Weapons/W1", records.get(NodeKind.WEAPON).get(0).get("uniqueName"));
        assertEquals("Lato", records.get(NodeKind.WEAPON).get(1).get("name"));
        assertTrue(records.get(NodeKind.RECIPE).get(0).get("ingredients") instanceof List);
    }

    @Test
    @DisplayName("Missing export file fails the read")
    void testMissingFile() throws IOException {
        write("ExportWeapons_en.json", "{\"ExportWeapons\": []}");

        RecordSourceException e = assertThrows(RecordSourceException.class, () -> source.read());
        assertTrue(e.getLocation().endsWith("ExportResources_en.json"));
    }

    @Test
    @DisplayName("Missing data directory fails the read")
    void testMissingDirectory() {
        properties.getSource().setDataDir(dataDir.resolve("nope").toString());

        assertThrows(RecordSourceException.class, () -> source.read());
    }

    @Test
    @DisplayName("Invalid JSON fails with the file named")
    void testInvalidJson() throws IOException {
        writeAll();
        write("ExportResources_en.json", "{\"ExportResources\": [");

        RecordSourceException e = assertThrows(RecordSourceException.class, () -> source.read());
        assertTrue(e.getMessage().contains("ExportResources_en.json"));
    }

    @Test
    @DisplayName("Missing top-level list reads as empty")
    void testMissingRootKey() throws IOException {
        writeAll();
        write("ExportRecipes_en.json", "{\"Other\": []}");

        assertTrue(source.read().get(NodeKind.RECIPE).isEmpty());
    }

    @Test
    @DisplayName("Non-object entries become empty records at their position")
    void testNonObjectEntries() throws IOException {
        writeAll();
        write("ExportResources_en.json", "{\"ExportResources\": [\"junk\", {\"uniqueName\": \"R2\"}]}");

        List<RawRecord> resources = source.read().get(NodeKind.RESOURCE);

        assertEquals(2, resources.size());
        assertTrue(resources.get(0).getFields().isEmpty());
        assertEquals("R2", resources.get(1).get("uniqueName"));
    }

    @Test
    @DisplayName("Raw control characters inside strings are tolerated")
    void testControlCharacters() throws IOException {
        writeAll();
        write("ExportResources_en.json", "{\"ExportResources\": [{\"uniqueName\": \"R1\", \"description\": \"line\nbreak\"}]}");

        assertEquals("line\nbreak", source.read().get(NodeKind.RESOURCE).get(0).get("description"));
    }

    @Test
    @DisplayName("Root key is the file name up to the first underscore")
    void testRootKey() {
        assertEquals("ExportWeapons", ExportFileRecordSource.rootKey("ExportWeapons_en.json"));
        assertEquals("ExportCustom", ExportFileRecordSource.rootKey("ExportCustom.json"));
    }
}

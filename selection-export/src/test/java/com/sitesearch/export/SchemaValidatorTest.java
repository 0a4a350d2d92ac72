package com.sitesearch.export;

import com.sitesearch.store.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaValidatorTest {
    private ExportFixtures fixtures;
    private SchemaValidator validator;

    @BeforeEach
    public void setUp() throws Exception {
        fixtures = new ExportFixtures();
        validator = new SchemaValidator(fixtures.store);
    }

    @AfterEach
    public void tearDown() {
        fixtures.close();
    }

    @Test
    public void testFieldByNameThenAlias() {
        FieldList fields = new FieldList(Arrays.asList(
                new Field("AREA_HA", "Area", FieldType.DOUBLE, 0, false),
                new Field("Area", "Legacy", FieldType.DOUBLE, 0, false)));

        assertEquals("Area", validator.resolveField(fields, "area").getName(), "Name wins over alias");
        assertEquals("Area", validator.resolveField(fields, "Legacy").getName());
        assertTrue(validator.fieldExists(fields, " AREA_HA "));
        assertFalse(validator.fieldExists(fields, "Hectares"));
        assertFalse(validator.fieldExists(fields, ""));
        assertFalse(validator.fieldExists((FieldList) null, "Area"));
    }

    @Test
    public void testFieldOfDataset() {
        assertTrue(validator.fieldExists("Habitats", "Notes"));
        assertFalse(validator.fieldExists("Habitats", "Distance"));
        assertFalse(validator.fieldExists("No Such Layer", "Notes"));
    }

    @Test
    public void testCatalogDatasets() {
        assertTrue(validator.exists(ExportFixtures.path("Habitats")));
        assertTrue(validator.featureClassExists(ExportFixtures.path("Habitats")));
        assertFalse(validator.tableExists(ExportFixtures.path("Habitats")));
        assertFalse(validator.exists(ExportFixtures.path("Missing")));
        assertFalse(validator.exists(""));
    }

    @Test
    public void testUnreadableWorkspaceCountsAsMissing() {
        assertFalse(validator.exists("/no/such/workspace.gdb/Habitats"));
    }

    @Test
    public void testRemoteWorkspaceAlwaysExists() {
        assertTrue(validator.exists("/connections/server.sde/GIS.Habitats"));
    }

    @Test
    public void testSingleFileChecksDisk(@TempDir Path folder) throws Exception {
        Path shapefile = folder.resolve("sites.shp");
        assertFalse(validator.exists(shapefile.toString()));

        Files.createFile(shapefile);
        assertTrue(validator.exists(shapefile.toString()));
        assertTrue(validator.tableExists(shapefile.toString()), "Single files are checked on disk only");
    }
}

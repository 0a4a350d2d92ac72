package com.sitesearch.export;

import com.sitesearch.store.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SelectionExporterTest {
    @TempDir
    Path folder;

    private ExportFixtures fixtures;
    private SelectionExporter exporter;
    private SchemaValidator validator;

    @BeforeEach
    public void setUp() throws Exception {
        fixtures = new ExportFixtures();
        exporter = fixtures.exporter();
        validator = exporter.getValidator();
    }

    @AfterEach
    public void tearDown() {
        fixtures.close();
    }

    private void assertCleanedUp() {
        assertFalse(fixtures.session.isLayerLoaded("TempOutput"), "Temporary layer left in session");
        assertFalse(fixtures.session.isTableLoaded("TempTable"), "Temporary table left in session");
        assertFalse(validator.exists(ExportFixtures.path("TempOutput")), "Temporary feature class not deleted");
        assertFalse(validator.exists(ExportFixtures.path("TempTable")), "Temporary table not deleted");
    }

    @Test
    public void testGroupedExportRestoresNames() throws Exception {
        Path output = folder.resolve("sites.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Area");
        request.setGroupColumns("Site");
        request.setStatisticsColumns("Area SUM");
        request.setRenameColumns(true);

        assertEquals(2, exporter.exportSelectionToCsv(request));

        assertEquals(Arrays.asList("Site,Area", "A,15", "B,7"), ExportFixtures.lines(output));
        assertCleanedUp();
    }

    @Test
    public void testGroupedExportWithoutRenameKeepsGeneratedNames() throws Exception {
        Path output = folder.resolve("sites.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Area,SUM_Area");
        request.setGroupColumns("Site");
        request.setStatisticsColumns("Area SUM");

        assertEquals(2, exporter.exportSelectionToCsv(request));

        assertEquals(Arrays.asList("Site,SUM_Area", "A,15", "B,7"), ExportFixtures.lines(output));
    }

    @Test
    public void testSelectionOnlyIsExported() throws Exception {
        fixtures.session.setSelection("Habitats", Arrays.asList(2L, 3L));
        Path output = folder.resolve("selected.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Area");
        request.setCheckForSelection(true);

        assertEquals(2, exporter.exportSelectionToCsv(request));
        assertEquals(Arrays.asList("Site,Area", "A,5", "B,7"), ExportFixtures.lines(output));
    }

    @Test
    public void testZeroRowsWritesHeaderAndCleansUp() throws Exception {
        fixtures.session.setSelection("Habitats", Collections.<Long>emptyList());
        Path output = folder.resolve("empty.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Area");

        assertEquals(0, exporter.exportSelectionToCsv(request));

        assertEquals(Collections.singletonList("Site,Area"), ExportFixtures.lines(output));
        assertCleanedUp();
    }

    @Test
    public void testZeroRowsWithoutHeaderWritesEmptyFile() throws Exception {
        fixtures.session.setSelection("Habitats", Collections.<Long>emptyList());
        Path output = folder.resolve("empty.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site");
        request.setIncludeHeaders(false);

        assertEquals(0, exporter.exportSelectionToCsv(request));
        assertEquals(0L, Files.size(output));
    }

    @Test
    public void testDistanceAndRadius() throws Exception {
        Path output = folder.resolve("distance.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Distance,Radius");
        request.setIncludeDistance(true);
        request.setTargetLayer("Targets");
        request.setRadius("2km");

        assertEquals(3, exporter.exportSelectionToCsv(request));

        assertEquals(Arrays.asList("Site,Distance,Radius", "A,100,2km", "A,0,2km", "B,1241,2km"),
                ExportFixtures.lines(output));
        assertCleanedUp();
    }

    @Test
    public void testRadiusSurvivesGrouping() throws Exception {
        Path output = folder.resolve("grouped.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Radius");
        request.setGroupColumns("Site");
        request.setRadius("500m");
        request.setRenameColumns(true);

        assertEquals(2, exporter.exportSelectionToCsv(request));
        assertEquals(Arrays.asList("Site,Radius", "A,500m", "B,500m"), ExportFixtures.lines(output));
    }

    @Test
    public void testAreaAddedToInputIsRemovedAfterwards() throws Exception {
        fixtures.runner.run(EngineOperation.COPY_FEATURES, "Habitats", ExportFixtures.path("Plain"));
        fixtures.runner.run(EngineOperation.DELETE_FIELD, ExportFixtures.path("Plain"), "Area");
        fixtures.session.addLayer("Plain", DatasetPath.parse(ExportFixtures.path("Plain")));

        Path output = folder.resolve("area.csv");
        ExportRequest request = fixtures.request("Plain", output);
        request.setColumns("Site,Area");
        request.setIncludeArea(true);
        request.setAreaUnit("ha");

        assertEquals(3, exporter.exportSelectionToCsv(request));

        assertEquals(Arrays.asList("Site,Area", "A,1", "A,1", "B,0.25"), ExportFixtures.lines(output));
        assertNull(fixtures.store.getFields("Plain").findField("Area"));
    }

    @Test
    public void testAllLiteralColumns() throws Exception {
        Path output = folder.resolve("literals.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("\"SiteRef\",\"Company\"");

        assertEquals(3, exporter.exportSelectionToCsv(request));

        List<String> lines = ExportFixtures.lines(output);
        assertEquals(4, lines.size());
        assertEquals("\"SiteRef\",\"Company\"", lines.get(0));
        assertEquals("\"SiteRef\",\"Company\"", lines.get(3));
    }

    @Test
    public void testAppendToExistingFile() throws Exception {
        Path output = folder.resolve("combined.csv");
        assertTrue(exporter.getSerializer().writeEmptyCsv(output.toString(), "Type,Site"));

        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("\"Habitat\",Site");
        request.setGroupColumns("Site");
        request.setOverwrite(false);
        request.setIncludeHeaders(false);

        assertEquals(2, exporter.exportSelectionToCsv(request));
        assertEquals(Arrays.asList("Type,Site", "\"Habitat\",A", "\"Habitat\",B"), ExportFixtures.lines(output));
    }

    @Test
    public void testAppendToMissingFileFails() {
        Path output = folder.resolve("absent.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site");
        request.setOverwrite(false);

        assertEquals(-1, exporter.exportSelectionToCsv(request));
        assertFalse(Files.exists(output));
    }

    @Test
    public void testLayerNotLoaded() {
        ExportRequest request = fixtures.request("Rivers", folder.resolve("rivers.csv"));
        request.setColumns("Name");

        assertEquals(-1, exporter.exportSelectionToCsv(request));
        assertFalse(exporter.exportSelectionToShapefile(request));
    }

    @Test
    public void testSelectionRequired() {
        ExportRequest request = fixtures.request("Habitats", folder.resolve("selected.csv"));
        request.setColumns("Site");
        request.setCheckForSelection(true);

        assertEquals(-1, exporter.exportSelectionToCsv(request));
    }

    @Test
    public void testUnknownAreaUnitFails() {
        ExportRequest request = fixtures.request("Habitats", folder.resolve("area.csv"));
        request.setColumns("Site");
        request.setIncludeArea(true);
        request.setAreaUnit("acres");

        assertEquals(-1, exporter.exportSelectionToCsv(request));
    }

    @Test
    public void testEngineFailureAbortsAndCleansUp() throws Exception {
        List<String> notices = new ArrayList<>();
        SelectionExporter notifying = new SelectionExporter(fixtures.store, fixtures.session, fixtures.runner,
                (title, message) -> notices.add(message));
        Path output = folder.resolve("failed.csv");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Radius");
        request.setRadius("a radius label far longer than twenty five characters");
        request.setNotifyUser(true);

        assertEquals(-1, notifying.exportSelectionToCsv(request));

        assertFalse(Files.exists(output));
        assertCleanedUp();
        assertEquals(1, notices.size());
        assertTrue(notices.get(0).startsWith("Function exportSelectionToCsv returned the following error: "),
                notices.get(0));
        assertTrue(notices.get(0).contains("too long"), notices.get(0));
    }

    @Test
    public void testDuplicateTemporaryLayersAreAllRemoved() throws Exception {
        DatasetPath temp = DatasetPath.parse(ExportFixtures.path("TempOutput"));
        fixtures.store.createDataset(temp, DatasetKind.FEATURE_CLASS, Collections.<Field>emptyList());
        fixtures.session.addLayer("TempOutput", temp);

        ExportRequest request = fixtures.request("Habitats", folder.resolve("out.csv"));
        request.setColumns("Site");

        assertEquals(3, exporter.exportSelectionToCsv(request));
        assertCleanedUp();
    }

    @Test
    public void testShapefileKeepsRequiredAndNamedFields() throws Exception {
        Path output = folder.resolve("habitats.shp");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Missing");

        assertTrue(exporter.exportSelectionToShapefile(request));

        assertTrue(Files.exists(output));
        assertEquals(Arrays.asList("OBJECTID", "Shape", "Site"),
                fixtures.store.getFields(output.toString()).getNames());
        assertEquals(3, fixtures.rows(output.toString()).size());
    }

    @Test
    public void testShapefileWithoutColumnsKeepsAllFields() throws Exception {
        Path output = folder.resolve("habitats.shp");
        ExportRequest request = fixtures.request("Habitats", output);

        assertTrue(exporter.exportSelectionToShapefile(request));

        assertEquals(Arrays.asList("OBJECTID", "Shape", "Site", "Area", "Notes"),
                fixtures.store.getFields(output.toString()).getNames());
    }

    @Test
    public void testShapefileDissolveWithDistance() throws Exception {
        Path output = folder.resolve("sites.shp");
        ExportRequest request = fixtures.request("Habitats", output);
        request.setColumns("Site,Area,Distance");
        request.setGroupColumns("Site");
        request.setStatisticsColumns("Area SUM");
        request.setRenameColumns(true);
        request.setIncludeDistance(true);
        request.setTargetLayer("Targets");

        assertTrue(exporter.exportSelectionToShapefile(request));

        assertEquals(Arrays.asList("OBJECTID", "Shape", "Site", "Area", "Distance"),
                fixtures.store.getFields(output.toString()).getNames());
        List<Row> rows = fixtures.rows(output.toString());
        assertEquals(2, rows.size());
        assertEquals("A", rows.get(0).get("Site"));
        assertEquals(15L, rows.get(0).get("Area"));
        assertEquals(0.0, (Double) rows.get(0).get("Distance"), 1e-9);
        assertCleanedUp();
    }

    @Test
    public void testShapefileNotOverwrittenUnlessAllowed() throws Exception {
        Path output = folder.resolve("habitats.shp");
        Files.createFile(output);
        ExportRequest request = fixtures.request("Habitats", output);
        request.setOverwrite(false);

        assertFalse(exporter.exportSelectionToShapefile(request));
    }
}

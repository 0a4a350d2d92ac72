package com.sitesearch.export;

import com.sitesearch.store.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DerivedFieldCalculatorTest {
    private ExportFixtures fixtures;
    private DerivedFieldCalculator calculator;

    @BeforeEach
    public void setUp() throws Exception {
        fixtures = new ExportFixtures();
        calculator = new DerivedFieldCalculator(fixtures.store, new SchemaValidator(fixtures.store), fixtures.runner);
        fixtures.runner.run(EngineOperation.COPY_FEATURES, "Habitats", ExportFixtures.path("Work"));
        fixtures.runner.run(EngineOperation.DELETE_FIELD, ExportFixtures.path("Work"), "Area");
    }

    @AfterEach
    public void tearDown() {
        fixtures.close();
    }

    @Test
    public void testAreaAddedInHectares() throws Exception {
        String work = ExportFixtures.path("Work");

        assertTrue(calculator.addArea(work, AreaUnit.HECTARES));

        Field area = fixtures.store.getFields(work).findField("Area");
        assertEquals(FieldType.DOUBLE, area.getType());
        assertEquals(20, area.getLength());
        List<Row> rows = fixtures.rows(work);
        assertEquals(1.0, (Double) rows.get(0).get("Area"), 1e-9);
        assertEquals(0.25, (Double) rows.get(2).get("Area"), 1e-9);
    }

    @Test
    public void testExistingAreaFieldIsRecalculated() throws Exception {
        String work = ExportFixtures.path("Work");
        calculator.addArea(work, AreaUnit.SQUARE_METERS);

        assertFalse(calculator.addArea(work, AreaUnit.SQUARE_KILOMETERS));
        assertEquals(0.01, (Double) fixtures.rows(work).get(0).get("Area"), 1e-12);

        calculator.removeArea(work);
        assertNull(fixtures.store.getFields(work).findField("Area"));
    }

    @Test
    public void testNoAreaForPoints() throws Exception {
        assertFalse(calculator.addArea("Targets", AreaUnit.HECTARES));
        assertNull(fixtures.store.getFields("Targets").findField("Area"));
    }

    @Test
    public void testDistanceToNearestTarget() throws Exception {
        String joined = ExportFixtures.path("Joined");

        calculator.addDistance("Habitats", "Targets", joined);

        List<Row> rows = fixtures.rows(joined);
        assertEquals(3, rows.size());
        assertEquals(100.0, (Double) rows.get(0).get("Distance"), 1e-9);
        assertEquals(0.0, (Double) rows.get(1).get("Distance"), 1e-9);
        assertEquals("T1", rows.get(2).get("Ref"));
    }

    @Test
    public void testRadiusBroadcast() throws Exception {
        String work = ExportFixtures.path("Work");

        assertTrue(calculator.addRadius(work, "500m"));

        Field radius = fixtures.store.getFields(work).findField("Radius");
        assertEquals(FieldType.STRING, radius.getType());
        assertEquals(25, radius.getLength());
        for (Row row : fixtures.rows(work)) {
            assertEquals("500m", row.get("Radius"));
        }
    }

    @Test
    public void testNoRadiusSentinel() throws Exception {
        String work = ExportFixtures.path("Work");

        assertFalse(calculator.addRadius(work, "none"));
        assertFalse(calculator.addRadius(work, "None"));
        assertFalse(calculator.addRadius(work, ""));
        assertNull(fixtures.store.getFields(work).findField("Radius"));
        assertTrue(DerivedFieldCalculator.isNoRadius(null));
        assertFalse(DerivedFieldCalculator.isNoRadius("1km"));
    }

    @Test
    public void testTooLongRadiusFails() {
        String work = ExportFixtures.path("Work");

        assertThrows(OperationFailedException.class,
                () -> calculator.addRadius(work, "a radius label far longer than twenty five characters"));
    }
}

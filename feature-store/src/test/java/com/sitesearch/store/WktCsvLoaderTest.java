package com.sitesearch.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WktCsvLoaderTest {
    private InMemoryFeatureStore store;
    private WktCsvLoader loader;

    @BeforeEach
    public void setUp() {
        store = StoreFixtures.newStore(new MapSession());
        loader = new WktCsvLoader(store);
    }

    @AfterEach
    public void tearDown() {
        store.close();
    }

    @Test
    public void testLoadFeatureClass() throws Exception {
        Dataset sites = loader.load(Paths.get("src/test/resources/sources/sites.csv"),
                DatasetPath.of(StoreFixtures.WORKSPACE, "Sites"));

        assertEquals(DatasetKind.FEATURE_CLASS, sites.getKind());
        FieldList fields = sites.getFields();
        assertEquals("SiteRef", fields.get(2).getName(), "BOM should be stripped from the first header");
        assertEquals(FieldType.STRING, fields.findField("Name").getType());
        assertEquals(FieldType.DOUBLE, fields.findField("Hectares").getType());
        assertNull(fields.findField("WKT"), "The geometry column is not an attribute");

        List<Row> rows = new ArrayList<>(sites.getRows());
        assertEquals(3, rows.size());
        assertEquals("Oak Wood, North", rows.get(0).get("Name"), "Quoted commas stay in the value");
        assertEquals(GeometryKind.POLYGON, GeometryKind.of(rows.get(0).getShape()));
        assertEquals(GeometryKind.POINT, GeometryKind.of(rows.get(2).getShape()));
        assertNull(rows.get(2).get("Hectares"));
    }

    @Test
    public void testLoadTableWithoutGeometryColumn() throws Exception {
        Dataset codes = loader.load(Paths.get("src/test/resources/sources/codes.csv"),
                DatasetPath.of(StoreFixtures.WORKSPACE, "Codes"));

        assertEquals(DatasetKind.TABLE, codes.getKind());
        assertEquals(FieldType.INTEGER, codes.getFields().findField("Count").getType());
        assertEquals(7L, codes.getRows().get(1).get("Count"));
    }

    @Test
    public void testParseRowKeepsEmptyValues() {
        assertArrayEquals(new String[]{"a", "", "c d", ""}, WktCsvLoader.parseRow("a,, c d ,"));
        assertArrayEquals(new String[]{"x, y", "z"}, WktCsvLoader.parseRow("\"x, y\",z"));
    }
}

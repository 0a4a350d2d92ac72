package com.sitesearch.search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SearchStringsTest {

    @Test
    public void testReferenceNames() {
        String reference = SearchStrings.reference("AB/123/4", "_");
        String shortRef = SearchStrings.keepNumbersAndSpaces(reference, "_");

        assertEquals("AB_123_4", reference);
        assertEquals("123_4", shortRef);
        assertEquals("4", SearchStrings.getSubref(shortRef, "_"));
    }

    @Test
    public void testShortReferenceTrimsSeparators() {
        assertEquals("2024_17", SearchStrings.keepNumbersAndSpaces(" ENQ_2024_17_X ", "_"));
        assertEquals("17", SearchStrings.keepNumbersAndSpaces("REF17", ""));
        assertEquals("", SearchStrings.keepNumbersAndSpaces("NONE", "_"));
    }

    @Test
    public void testSubrefWithoutSeparator() {
        assertEquals("123", SearchStrings.getSubref("123", "_"));
        assertEquals("1_2", SearchStrings.getSubref("1_2", ""));
    }

    @Test
    public void testStripIllegals() {
        assertEquals("Smith_s Farm_ North_", SearchStrings.stripIllegals("Smith/s Farm: North?", "_"));
        assertEquals("a_b_c", SearchStrings.stripIllegals("a\tb|c", "_"));
        assertEquals("Plain Name", SearchStrings.stripIllegals("Plain Name", "_"));
        assertNull(SearchStrings.stripIllegals(null, "_"));
    }

    @Test
    public void testReplaceSearchStrings() {
        String text = "Searches/%ShortRef%/%SITENAME% %ref% (%radius%, %subref%)";

        String replaced = SearchStrings.replaceSearchStrings(text, "AB_123_4", "Home Farm", "123_4", "4", "2km");

        assertEquals("Searches/123_4/Home Farm AB_123_4 (2km, 4)", replaced);
    }

    @Test
    public void testReplaceKeepsDollarSigns() {
        assertEquals("Site $1 a\\b", SearchStrings.replaceSearchStrings("Site %sitename%", "", "$1 a\\b", "", "", ""));
        assertEquals("%unknown%", SearchStrings.replaceSearchStrings("%unknown%", "r", "s", "", "", ""));
        assertEquals("", SearchStrings.replaceSearchStrings("", "r", "s", "", "", ""));
    }

    @Test
    public void testAlignAddsFirstForUngroupedColumns() {
        String aligned = SearchStrings.alignStatisticsColumns("Site,Area,Status,\"Fixed\"", "Area SUM", "Site");

        assertEquals("Area SUM;Status FIRST", aligned);
    }

    @Test
    public void testAlignIsCaseInsensitive() {
        assertEquals("area SUM", SearchStrings.alignStatisticsColumns("SITE,Area", "area SUM", "Site"));
        assertEquals("Status FIRST", SearchStrings.alignStatisticsColumns("Site,Status,status", "", "Site"));
    }

    @Test
    public void testAlignWithoutGroupsLeavesStatistics() {
        assertEquals("Area SUM", SearchStrings.alignStatisticsColumns("Site,Status", "Area SUM", ""));
        assertEquals("", SearchStrings.alignStatisticsColumns("Site,Status", "", null));
    }
}

package com.sitesearch.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValuesTest {

    @Test
    public void testWholeDoublesLoseTrailingZero() {
        assertEquals("15", Values.toText(15.0));
        assertEquals("2.5", Values.toText(2.5));
        assertEquals("100", Values.toText(100.0));
        assertEquals("0.125", Values.toText(0.125));
        assertEquals("42", Values.toText(42L));
        assertEquals("", Values.toText(null));
    }

    @Test
    public void testOrderPutsNullsFirstAndIgnoresCase() {
        List<Object> values = new ArrayList<>(Arrays.asList("beta", null, "Alpha", "alpha2"));
        values.sort(Values.ORDER);
        assertEquals(Arrays.asList(null, "Alpha", "alpha2", "beta"), values);

        List<Object> numbers = new ArrayList<>(Arrays.asList(10L, 9.5, 100L));
        numbers.sort(Values.ORDER);
        assertEquals(Arrays.asList(9.5, 10L, 100L), numbers, "Numbers compare numerically");
    }
}

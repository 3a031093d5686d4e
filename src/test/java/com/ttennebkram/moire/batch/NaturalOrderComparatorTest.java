package com.ttennebkram.moire.batch;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class NaturalOrderComparatorTest {

    private static List<String> sorted(String... names) {
        List<String> list = new ArrayList<>(Arrays.asList(names));
        list.sort(NaturalOrderComparator.INSTANCE);
        return list;
    }

    @Test
    public void numbersCompareByValue() {
        assertEquals(Arrays.asList("page1.png", "page2.png", "page10.png", "page100.png"),
            sorted("page10.png", "page2.png", "page100.png", "page1.png"));
    }

    @Test
    public void textIgnoresCase() {
        assertEquals(Arrays.asList("alpha", "Beta", "gamma"), sorted("gamma", "Beta", "alpha"));
    }

    @Test
    public void leadingZerosAndTiesAreStable() {
        NaturalOrderComparator cmp = NaturalOrderComparator.INSTANCE;
        assertTrue(cmp.compare("scan007", "scan7") != 0);
        assertTrue(cmp.compare("scan007", "scan8") < 0);
        assertTrue(cmp.compare("File", "file") != 0);
        assertEquals(0, cmp.compare("same", "same"));
    }

    @Test
    public void longDigitRunsDoNotOverflow() {
        assertTrue(NaturalOrderComparator.INSTANCE.compare("a99999999999999999999", "a100000000000000000000") < 0);
    }

    @Test
    public void splitsIntoDigitAndTextRuns() {
        assertEquals(Arrays.asList("ch", "12", "_p", "3", ".tif"), NaturalOrderComparator.split("ch12_p3.tif"));
    }
}

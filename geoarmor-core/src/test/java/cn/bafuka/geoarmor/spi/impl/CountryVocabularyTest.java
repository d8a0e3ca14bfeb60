package cn.bafuka.geoarmor.spi.impl;

import org.junit.BeforeClass;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * CountryVocabulary 单元测试
 */
public class CountryVocabularyTest {

    private static CountryVocabulary vocabulary;

    @BeforeClass
    public static void load() {
        vocabulary = CountryVocabulary.loadDefault();
    }

    @Test
    public void testExactMatch() {
        assertEquals("France", vocabulary.canonicalize("France"));
        assertEquals("United States", vocabulary.canonicalize("United States"));
    }

    /**
     * 测试别名：忽略空白、点、横线和大小写
     */
    @Test
    public void testAliases() {
        assertEquals("United States", vocabulary.canonicalize("USA"));
        assertEquals("United States", vocabulary.canonicalize("U.S.A."));
        assertEquals("United States", vocabulary.canonicalize("us"));
        assertEquals("United Kingdom", vocabulary.canonicalize("UK"));
        assertEquals("United Arab Emirates", vocabulary.canonicalize("U.A.E"));
        assertEquals("Europe", vocabulary.canonicalize("European Union"));
    }

    @Test
    public void testCaseInsensitive() {
        assertEquals("Japan", vocabulary.canonicalize("japan"));
        assertEquals("New Zealand", vocabulary.canonicalize("  NEW ZEALAND "));
    }

    @Test
    public void testUnrecognized() {
        assertNull(vocabulary.canonicalize("Atlantis"));
        assertNull(vocabulary.canonicalize(null));
        assertFalse(vocabulary.isRecognized("Atlantis"));
        assertTrue(vocabulary.isRecognized("Brazil"));
    }

    @Test
    public void testCountriesLoaded() {
        assertTrue(vocabulary.getCountries().contains("South Korea"));
        assertEquals(61, vocabulary.getCountries().size());
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingResource() {
        CountryVocabulary.load("geoarmor/missing.json");
    }
}

package org.aksw.fol2nl.lexicon.gender;

import static org.junit.Assert.*;

import java.io.IOException;

import org.junit.Test;

public class LexiconBasedGenderDetectorTest {

    @Test
    public void testClasspathNames() throws IOException {
        GenderDetector genderDetector = LexiconBasedGenderDetector.fromClasspath();
        assertEquals(Gender.MALE, genderDetector.getGender("John"));
        assertEquals(Gender.MALE, genderDetector.getGender("ringo"));
        assertEquals(Gender.FEMALE, genderDetector.getGender("Mary"));
        assertEquals(Gender.FEMALE, genderDetector.getGender(" YOKO "));
        assertEquals(Gender.UNKNOWN, genderDetector.getGender("Guitar"));
    }
}

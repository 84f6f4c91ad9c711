/**
 *
 */
package org.aksw.fol2nl.lexicon.gender;

import java.io.IOException;
import java.net.URL;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Charsets;
import com.google.common.io.Resources;

/**
 * Looks first names up in lists of male and female names.
 */
public class LexiconBasedGenderDetector implements GenderDetector {

    private static final Logger logger = Logger.getLogger(LexiconBasedGenderDetector.class.getName());

    public static final String MALE_NAMES = "male.txt";
    public static final String FEMALE_NAMES = "female.txt";

    private final Set<String> male;
    private final Set<String> female;

    public LexiconBasedGenderDetector(Set<String> male, Set<String> female) {
        this.male = normalize(male);
        this.female = normalize(female);
    }

    /**
     * Creates a detector from the name lists shipped on the classpath.
     *
     * @throws IOException if the name lists cannot be read
     */
    public static LexiconBasedGenderDetector fromClasspath() throws IOException {
        Set<String> male = readNames(Resources.getResource(MALE_NAMES));
        Set<String> female = readNames(Resources.getResource(FEMALE_NAMES));
        logger.info("Loaded " + male.size() + " male and " + female.size() + " female names");
        return new LexiconBasedGenderDetector(male, female);
    }

    /*
     * (non-Javadoc) @see
     * org.aksw.fol2nl.lexicon.gender.GenderDetector#getGender(java.lang.String)
     */
    @Override
    public Gender getGender(String name) {
        String key = name.trim().toLowerCase(Locale.ENGLISH);
        if (male.contains(key)) {
            return Gender.MALE;
        } else if (female.contains(key)) {
            return Gender.FEMALE;
        } else {
            return Gender.UNKNOWN;
        }
    }

    static Set<String> readNames(URL resource) throws IOException {
        Set<String> names = new HashSet<String>();
        List<String> lines = Resources.readLines(resource, Charsets.UTF_8);
        for (String l : lines) {
            l = l.trim();
            if (!l.startsWith("#") && !l.isEmpty()) {
                names.add(l);
            }
        }
        return names;
    }

    private static Set<String> normalize(Set<String> names) {
        Set<String> result = new HashSet<String>();
        for (String name : names) {
            result.add(name.toLowerCase(Locale.ENGLISH));
        }
        return result;
    }
}

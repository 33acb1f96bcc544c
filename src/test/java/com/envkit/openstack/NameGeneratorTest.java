package com.envkit.openstack;

import com.envkit.devops.StubEnvironment;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NameGeneratorTest {

    private static String generate(String base, String login, String hostname) {
        return new NameGenerator(new StubEnvironment(login, hostname, null)).generate(base);
    }

    private static long hyphens(String s) {
        return s.chars().filter(c -> c == '-').count();
    }

    @Test
    public void generatesAName() {
        assertTrue(generate("potatoes", "user", "host").matches("^potatoes-user-host-[0-9a-z]{7}$"));
    }

    @Test
    public void limitsLongHostnamesTo63() {
        String name = generate("potatoes", "user", "ab.c".repeat(20));
        assertTrue(name.length() <= 63, name);
        assertTrue(name.startsWith("potatoes-user-abcabc"), name);
    }

    @Test
    public void truncatesToExactly63WhenEverythingIsLong() {
        String name = generate("ijkl".repeat(20), "abcd".repeat(20), "efgh".repeat(20));
        assertEquals(63, name.length());
        assertEquals(3, hyphens(name));
        assertTrue(name.matches("^ijkl\\w+-abcd\\w+-efgh\\w+-[0-9a-z]{7}$"), name);
    }

    @Test
    public void stripsPunctuationLeavingThreeSeparators() {
        String name = generate("a.instance-name", "some.u-se-r", "a.host-name");
        assertFalse(name.contains("."));
        assertEquals(3, hyphens(name));
        assertTrue(name.startsWith("ainstancename-someuser-ahostname-"), name);
    }

    @Test
    public void substitutesPlaceholderWithoutLogin() {
        assertTrue(generate("potatoes", null, "host").startsWith("potatoes-nologin-host-"));
    }

    @Test
    public void repeatedCallsDifferOnlyInSuffix() {
        NameGenerator generator = new NameGenerator(new StubEnvironment("user", "host", null));
        Set<String> names = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            String name = generator.generate("potatoes");
            assertTrue(name.startsWith("potatoes-user-host-"));
            names.add(name);
        }
        assertTrue(names.size() > 1);
    }
}

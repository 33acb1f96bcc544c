package com.envkit.openstack;

import com.envkit.devops.EnvironmentProbe;

import java.util.Random;

public class NameGenerator {
    public static final int MAX_LENGTH = 63;
    public static final String NO_LOGIN = "nologin";
    static final int SUFFIX_LENGTH = 7;

    private final EnvironmentProbe env;
    private final Random random;

    public NameGenerator(EnvironmentProbe env) {
        this(env, new Random());
    }

    NameGenerator(EnvironmentProbe env, Random random) {
        this.env = env;
        this.random = random;
    }

    // <base>-<login>-<hostname>-<suffix>, at most 63 characters
    public String generate(String baseName) {
        String login = env.login();
        String[] parts = {
                sanitize(baseName),
                sanitize(login == null ? NO_LOGIN : login),
                sanitize(env.hostname())
        };
        String suffix = randomSuffix();
        // three separators plus the suffix are never cut
        int budget = MAX_LENGTH - SUFFIX_LENGTH - 3;
        while (parts[0].length() + parts[1].length() + parts[2].length() > budget) {
            int longest = 0;
            for (int i = 1; i < parts.length; i++) {
                if (parts[i].length() >= parts[longest].length()) {
                    longest = i;
                }
            }
            parts[longest] = parts[longest].substring(0, parts[longest].length() - 1);
        }
        return String.join("-", parts[0], parts[1], parts[2], suffix);
    }

    static String sanitize(String component) {
        return component == null ? "" : component.replaceAll("[^A-Za-z0-9]", "");
    }

    private String randomSuffix() {
        StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(Character.forDigit(random.nextInt(36), 36));
        }
        return sb.toString();
    }
}

package com.envkit.devops;

import java.nio.file.Path;

public class StubEnvironment implements EnvironmentProbe {
    private final String login, hostname;
    private final Path home;

    public StubEnvironment(String login, String hostname, Path home) {
        this.login = login;
        this.hostname = hostname;
        this.home = home;
    }

    @Override
    public String login() {
        return login;
    }

    @Override
    public String hostname() {
        return hostname;
    }

    @Override
    public Path userHome() {
        return home;
    }
}

package com.envkit.devops;

/* Local operating system identity used for defaults (server names, SSH keys) */

import java.nio.file.Path;

public interface EnvironmentProbe {
    // login name of the user running us, null in a non-login context
    String login();

    String hostname();

    Path userHome();
}

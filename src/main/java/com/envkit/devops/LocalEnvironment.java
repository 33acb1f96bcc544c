package com.envkit.devops;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import software.amazon.awssdk.utils.StringUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class LocalEnvironment implements EnvironmentProbe {
    final static Logger LOG = LogManager.getLogger(LocalEnvironment.class);

    @Override
    public String login() {
        // user.name is always set, so go by the login environment instead
        String login = System.getenv("LOGNAME");
        if (StringUtils.isBlank(login)) {
            login = System.getenv("USER");
        }
        return StringUtils.isBlank(login) ? null : login;
    }

    @Override
    public String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.warn("Could not resolve local hostname: " + e.getMessage());
            String env = System.getenv("HOSTNAME");
            return StringUtils.isBlank(env) ? "localhost" : env;
        }
    }

    @Override
    public Path userHome() {
        return Paths.get(System.getProperty("user.home"));
    }
}

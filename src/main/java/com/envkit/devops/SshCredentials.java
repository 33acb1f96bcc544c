package com.envkit.devops;

public class SshCredentials {
    private final String username, password, privateKeyPath;

    private SshCredentials(String username, String password, String privateKeyPath) {
        this.username = username;
        this.password = password;
        this.privateKeyPath = privateKeyPath;
    }

    public static SshCredentials password(String username, String password) {
        return new SshCredentials(username, password, null);
    }

    public static SshCredentials privateKey(String username, String privateKeyPath) {
        return new SshCredentials(username, null, privateKeyPath);
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getPrivateKeyPath() {
        return privateKeyPath;
    }

    @Override
    public String toString() {
        return username + (password != null ? " (password)" : " (key " + privateKeyPath + ")");
    }
}

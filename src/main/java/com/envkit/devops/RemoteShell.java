package com.envkit.devops;

public interface RemoteShell extends AutoCloseable {
    // runs one command and returns its standard output
    String run(String command) throws ProviderException;

    @Override
    void close();
}

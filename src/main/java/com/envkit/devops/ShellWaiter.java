package com.envkit.devops;

public interface ShellWaiter {
    // returns once a remote shell answers on host:port, fails after timeoutSeconds
    void waitForShell(String host, int port, int timeoutSeconds) throws UnreachableException;
}

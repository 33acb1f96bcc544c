package com.envkit.devops;

public class PoolExhaustedException extends ActionFailedException {
    private final String pool;

    public PoolExhaustedException(String pool) {
        super("No available IPs in pool <" + pool + ">");
        this.pool = pool;
    }

    public String getPool() {
        return pool;
    }
}

package com.envkit.devops;

public class FloatingAddress {
    private final String ip, fixedIp, instanceId, pool;

    public FloatingAddress(String ip, String fixedIp, String instanceId, String pool) {
        this.ip = ip;
        this.fixedIp = fixedIp;
        this.instanceId = instanceId;
        this.pool = pool;
    }

    public String getIp() {
        return ip;
    }

    public String getFixedIp() {
        return fixedIp;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getPool() {
        return pool;
    }

    // not mapped to a fixed IP and not associated with any instance
    public boolean isFree() {
        return fixedIp == null && instanceId == null;
    }

    @Override
    public String toString() {
        return ip + "[pool=" + pool + ",fixed=" + fixedIp + ",instance=" + instanceId + "]";
    }
}

package com.envkit.openstack;

import com.envkit.devops.CloudProviderInterface;
import com.envkit.devops.FloatingAddress;
import com.envkit.devops.PoolExhaustedException;
import com.envkit.devops.ProviderException;
import com.envkit.devops.ServerHandle;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

public class FloatingIpAllocator {
    final static Logger LOG = LogManager.getLogger(FloatingIpAllocator.class);
    // two drivers in one JVM must not grab the same free address
    private static final Object POOL_LOCK = new Object();

    private final CloudProviderInterface provider;

    public FloatingIpAllocator(CloudProviderInterface provider) {
        this.provider = provider;
    }

    public String attachFromPool(ServerHandle server, String pool) throws ProviderException, PoolExhaustedException {
        synchronized (POOL_LOCK) {
            LOG.info("Attaching floating IP from <" + pool + "> pool");
            for (FloatingAddress address : provider.listFloatingAddresses()) {
                if (pool.equals(address.getPool()) && address.isFree()) {
                    return attach(server, address.getIp());
                }
            }
            throw new PoolExhaustedException(pool);
        }
    }

    public String attach(ServerHandle server, String ip) throws ProviderException {
        LOG.info("Attaching floating IP <" + ip + "> to " + server.getId());
        provider.associateAddress(server, ip);
        return ip;
    }
}

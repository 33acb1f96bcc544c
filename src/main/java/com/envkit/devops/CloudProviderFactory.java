package com.envkit.devops;

public interface CloudProviderFactory {
    // set up cloud provider API (credentials, region, SSL handling) from validated configuration
    CloudProviderInterface connect(InstanceConfig config) throws ProviderException;
}

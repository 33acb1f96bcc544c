package com.envkit.devops;

/* Talk to the infrastructure API on behalf of one instance lifecycle */

import java.util.List;

public interface CloudProviderInterface {
    // candidates for image/flavor/network reference resolution, in provider listing order
    List<NamedResource> listImages() throws ProviderException;

    List<NamedResource> listFlavors() throws ProviderException;

    List<NamedResource> listNetworks() throws ProviderException;

    // floating address inventory across all pools
    List<FloatingAddress> listFloatingAddresses() throws ProviderException;

    // create infrastructure; returns as soon as the provider accepted the request
    ServerHandle createServer(ServerRequest request) throws ProviderException;

    // block until the server reports itself active, then return a fresh handle
    ServerHandle waitForActive(String serverId, int timeoutSeconds) throws ProviderException;

    // check for infrastructure; null when the server does not exist (anymore)
    ServerHandle getServer(String serverId) throws ProviderException;

    // delete infrastructure
    void deleteServer(String serverId) throws ProviderException;

    void associateAddress(ServerHandle server, String ip) throws ProviderException;

    // remote execution channel to a booted server
    RemoteShell openShell(String host, int port, SshCredentials credentials) throws ProviderException;
}

package com.envkit.openstack;

import com.envkit.devops.*;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.openstack4j.api.Builders;
import org.openstack4j.api.OSClient;
import org.openstack4j.api.exceptions.OS4JException;
import org.openstack4j.model.common.ActionResponse;
import org.openstack4j.model.compute.Flavor;
import org.openstack4j.model.compute.FloatingIP;
import org.openstack4j.model.compute.Image;
import org.openstack4j.model.compute.Server;
import org.openstack4j.model.compute.builder.ServerCreateBuilder;
import org.openstack4j.model.network.Network;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CloudProviderInterface} on top of openstack4j. Every openstack4j runtime exception is reported as a
 * {@link ProviderException} carrying the underlying message.
 */
public class OpenstackCloudProvider implements CloudProviderInterface {
    final static Logger LOG = LogManager.getLogger(OpenstackCloudProvider.class);
    static final String AUTHORIZED_KEYS = "/root/.ssh/authorized_keys";

    private final OSClient<?> os;

    public OpenstackCloudProvider(OSClient<?> os) {
        this.os = os;
    }

    @Override
    public List<NamedResource> listImages() throws ProviderException {
        try {
            List<NamedResource> images = new ArrayList<>();
            for (Image image : os.compute().images().list()) {
                images.add(new NamedResource(image.getId(), image.getName()));
            }
            return images;
        } catch (OS4JException e) {
            throw new ProviderException("Listing images failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<NamedResource> listFlavors() throws ProviderException {
        try {
            List<NamedResource> flavors = new ArrayList<>();
            for (Flavor flavor : os.compute().flavors().list()) {
                flavors.add(new NamedResource(flavor.getId(), flavor.getName()));
            }
            return flavors;
        } catch (OS4JException e) {
            throw new ProviderException("Listing flavors failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<NamedResource> listNetworks() throws ProviderException {
        try {
            List<NamedResource> networks = new ArrayList<>();
            for (Network network : os.networking().network().list()) {
                networks.add(new NamedResource(network.getId(), network.getName()));
            }
            return networks;
        } catch (OS4JException e) {
            throw new ProviderException("Listing networks failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<FloatingAddress> listFloatingAddresses() throws ProviderException {
        try {
            List<FloatingAddress> addresses = new ArrayList<>();
            for (FloatingIP ip : os.compute().floatingIps().list()) {
                addresses.add(new FloatingAddress(ip.getFloatingIpAddress(), ip.getFixedIpAddress(),
                        ip.getInstanceId(), ip.getPool()));
            }
            return addresses;
        } catch (OS4JException e) {
            throw new ProviderException("Listing floating IPs failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ServerHandle createServer(ServerRequest request) throws ProviderException {
        ServerCreateBuilder sc = Builders.server()
                .name(request.getName())
                .image(request.getImageId())
                .flavor(request.getFlavorId());
        if (request.getKeyName() != null) {
            sc.keypairName(request.getKeyName());
        } else if (request.getPublicKey() != null) {
            sc.addPersonality(AUTHORIZED_KEYS, request.getPublicKey());
        }
        for (String group : request.getSecurityGroups()) {
            sc.addSecurityGroup(group);
        }
        if (!request.getNetworkIds().isEmpty()) {
            sc.networks(request.getNetworkIds());
        }
        if (request.getUserData() != null) {
            sc.userData(Base64.getEncoder().encodeToString(request.getUserData().getBytes(StandardCharsets.UTF_8)));
        }
        try {
            Server server = os.compute().servers().boot(sc.build());
            return wrap(server);
        } catch (OS4JException e) {
            throw new ProviderException("Creating server " + request.getName() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ServerHandle waitForActive(String serverId, int timeoutSeconds) throws ProviderException {
        Server server;
        try {
            server = os.compute().servers().waitForServerStatus(serverId, Server.Status.ACTIVE, timeoutSeconds, TimeUnit.SECONDS);
        } catch (OS4JException e) {
            throw new ProviderException("Waiting for server " + serverId + " failed: " + e.getMessage(), e);
        }
        if (server == null) {
            throw new ProviderException("Server " + serverId + " disappeared while booting");
        }
        if (server.getStatus() == Server.Status.ERROR) {
            String fault = server.getFault() != null ? server.getFault().getMessage() : "no fault reported";
            throw new ProviderException("Server " + serverId + " failed to boot: " + fault);
        }
        if (server.getStatus() != Server.Status.ACTIVE) {
            throw new ProviderException("Server " + serverId + " not active after " + timeoutSeconds + "s, status " + server.getStatus());
        }
        return wrap(server);
    }

    @Override
    public ServerHandle getServer(String serverId) throws ProviderException {
        try {
            Server server = os.compute().servers().get(serverId);
            return server == null ? null : wrap(server);
        } catch (OS4JException e) {
            throw new ProviderException("Looking up server " + serverId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteServer(String serverId) throws ProviderException {
        ActionResponse response;
        try {
            response = os.compute().servers().delete(serverId);
        } catch (OS4JException e) {
            throw new ProviderException("Deleting server " + serverId + " failed: " + e.getMessage(), e);
        }
        // deleted out-of-band in the meantime
        if (!response.isSuccess() && response.getCode() != 404) {
            throw new ProviderException("Deleting server " + serverId + " failed: " + response.getFault());
        }
    }

    @Override
    public void associateAddress(ServerHandle server, String ip) throws ProviderException {
        ActionResponse response;
        try {
            Server target = server instanceof OpenstackServer
                    ? ((OpenstackServer) server).unwrap()
                    : os.compute().servers().get(server.getId());
            response = os.compute().floatingIps().addFloatingIP(target, ip);
        } catch (OS4JException e) {
            throw new ProviderException("Associating " + ip + " failed: " + e.getMessage(), e);
        }
        if (!response.isSuccess()) {
            throw new ProviderException("Associating " + ip + " with " + server.getId() + " failed: " + response.getFault());
        }
    }

    @Override
    public RemoteShell openShell(String host, int port, SshCredentials credentials) {
        return new SshUtil(host, port, credentials);
    }

    private OpenstackServer wrap(Server server) {
        return new OpenstackServer(server, os.compute().floatingIps());
    }
}

package com.envkit.openstack;

import com.envkit.devops.AddressEntry;
import com.envkit.devops.ProviderException;
import com.envkit.devops.ServerHandle;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.openstack4j.api.compute.ComputeFloatingIPService;
import org.openstack4j.api.exceptions.OS4JException;
import org.openstack4j.api.exceptions.ResponseException;
import org.openstack4j.model.compute.Address;
import org.openstack4j.model.compute.FloatingIP;
import org.openstack4j.model.compute.Server;
import software.amazon.awssdk.utils.StringUtils;

import java.util.*;

public class OpenstackServer implements ServerHandle {
    final static Logger LOG = LogManager.getLogger(OpenstackServer.class);
    static final String TYPE_FLOATING = "floating";
    static final String TYPE_FIXED = "fixed";

    private final Server server;
    private final ComputeFloatingIPService floatingIps;
    private Boolean publicPrivateSupported = null;
    private final List<String> publicAddresses = new ArrayList<>();
    private final List<String> privateAddresses = new ArrayList<>();

    public OpenstackServer(Server server, ComputeFloatingIPService floatingIps) {
        this.server = server;
        this.floatingIps = floatingIps;
    }

    public Server unwrap() {
        return server;
    }

    @Override
    public String getId() {
        return server.getId();
    }

    @Override
    public String getName() {
        return server.getName();
    }

    @Override
    public String getAdminPassword() {
        return server.getAdminPass();
    }

    @Override
    public Map<String, List<AddressEntry>> addressGroups() {
        Map<String, List<AddressEntry>> groups = new LinkedHashMap<>();
        if (server.getAddresses() == null || server.getAddresses().getAddresses() == null) {
            return groups;
        }
        for (Map.Entry<String, List<? extends Address>> group : server.getAddresses().getAddresses().entrySet()) {
            List<AddressEntry> entries = new ArrayList<>();
            for (Address addr : group.getValue()) {
                entries.add(new AddressEntry(addr.getVersion(), addr.getAddr()));
            }
            groups.put(group.getKey(), entries);
        }
        return groups;
    }

    // public = floating IPs bound to this server, private = fixed addresses; needs the floating-ip extension
    @Override
    public boolean hasPublicPrivateAddresses() throws ProviderException {
        if (publicPrivateSupported == null) {
            List<? extends FloatingIP> inventory;
            try {
                inventory = floatingIps.list();
            } catch (ResponseException e) {
                if (e.getStatus() == 404 || e.getStatus() == 403) {
                    LOG.info("Floating IP extension not available (" + e.getStatus() + ")");
                    publicPrivateSupported = false;
                    return false;
                }
                throw new ProviderException("Listing floating IPs failed: " + e.getMessage(), e);
            } catch (OS4JException e) {
                throw new ProviderException("Listing floating IPs failed: " + e.getMessage(), e);
            }
            for (FloatingIP ip : inventory) {
                if (getId().equals(ip.getInstanceId()) && !StringUtils.isEmpty(ip.getFloatingIpAddress())) {
                    publicAddresses.add(ip.getFloatingIpAddress());
                }
            }
            for (Address addr : flatten()) {
                if (TYPE_FLOATING.equals(addr.getType())) {
                    if (!publicAddresses.contains(addr.getAddr())) {
                        publicAddresses.add(addr.getAddr());
                    }
                } else if (TYPE_FIXED.equals(addr.getType())) {
                    privateAddresses.add(addr.getAddr());
                }
            }
            publicPrivateSupported = true;
        }
        return publicPrivateSupported;
    }

    @Override
    public List<String> publicAddresses() {
        return Collections.unmodifiableList(publicAddresses);
    }

    @Override
    public List<String> privateAddresses() {
        return Collections.unmodifiableList(privateAddresses);
    }

    @Override
    public List<String> allAddresses() {
        List<String> all = new ArrayList<>();
        for (Address addr : flatten()) {
            all.add(addr.getAddr());
        }
        if (!StringUtils.isEmpty(server.getAccessIPv4()) && !all.contains(server.getAccessIPv4())) {
            all.add(server.getAccessIPv4());
        }
        if (!StringUtils.isEmpty(server.getAccessIPv6()) && !all.contains(server.getAccessIPv6())) {
            all.add(server.getAccessIPv6());
        }
        return all;
    }

    private List<Address> flatten() {
        List<Address> all = new ArrayList<>();
        if (server.getAddresses() == null || server.getAddresses().getAddresses() == null) {
            return all;
        }
        for (List<? extends Address> addresses : server.getAddresses().getAddresses().values()) {
            all.addAll(addresses);
        }
        return all;
    }

    @Override
    public String toString() {
        return server.getName() + "(" + server.getId() + ", " + server.getStatus() + ")";
    }
}

package com.envkit.openstack;

import com.envkit.devops.AddressEntry;
import com.envkit.devops.AddressSource;
import com.envkit.devops.AddressUnavailableException;
import com.envkit.devops.ProviderException;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Picks the one address we will SSH to. Deployments disagree on how they report addresses, so the views of an
 * {@link AddressSource} are tried in a fixed order:
 * <ol>
 *     <li>the configured network group of the structured map, if it exists;</li>
 *     <li>the public/private lookup, when the deployment supports it;</li>
 *     <li>otherwise the conventional {@code public} and {@code private} groups of the structured map;</li>
 *     <li>the flat address list when all of the above came back empty.</li>
 * </ol>
 * Public addresses win over private ones.
 */
public class IpSelector {
    final static Logger LOG = LogManager.getLogger(IpSelector.class);
    static final String PUBLIC_GROUP = "public";
    static final String PRIVATE_GROUP = "private";

    private final AddressParser parser;
    private final String networkName;

    public IpSelector(AddressParser parser, String networkName) {
        this.parser = parser;
        this.networkName = networkName;
    }

    public String select(AddressSource server) throws AddressUnavailableException, ProviderException {
        IpVersion version = parser.getVersion();
        Map<String, List<AddressEntry>> groups = server.addressGroups();
        if (networkName != null && groups.containsKey(networkName)) {
            for (AddressEntry entry : groups.get(networkName)) {
                if (entry.getVersion() == version.getNumber() || (entry.getVersion() == 0 && version.matches(entry.getAddr()))) {
                    LOG.info("Using address " + entry.getAddr() + " from network " + networkName);
                    return entry.getAddr();
                }
            }
            LOG.warn("Network " + networkName + " has no IPv" + version.getNumber() + " address, trying the others");
        }

        List<String> pub, priv;
        if (server.hasPublicPrivateAddresses()) {
            pub = server.publicAddresses();
            priv = server.privateAddresses();
        } else {
            LOG.info("Public/private address lookup not supported, reading the address groups");
            pub = addresses(groups.get(PUBLIC_GROUP));
            priv = addresses(groups.get(PRIVATE_GROUP));
        }
        if (isEmpty(pub) && isEmpty(priv)) {
            // no predictable network naming
            pub = server.allAddresses();
            priv = server.allAddresses();
        }

        AddressParser.Parsed parsed = parser.parse(pub, priv);
        LOG.debug("Candidate addresses: " + parsed);
        if (!parsed.publicAddresses().isEmpty()) {
            return parsed.publicAddresses().get(0);
        }
        if (!parsed.privateAddresses().isEmpty()) {
            return parsed.privateAddresses().get(0);
        }
        throw new AddressUnavailableException("Could not find an IPv" + version.getNumber() + " address");
    }

    private static List<String> addresses(List<AddressEntry> entries) {
        List<String> addrs = new ArrayList<>();
        if (entries != null) {
            for (AddressEntry entry : entries) {
                addrs.add(entry.getAddr());
            }
        }
        return addrs;
    }

    private static boolean isEmpty(List<String> list) {
        return list == null || list.isEmpty();
    }
}

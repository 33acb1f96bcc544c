package com.envkit.openstack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AddressParser {
    private final IpVersion version;

    public AddressParser(IpVersion version) {
        this.version = version;
    }

    public IpVersion getVersion() {
        return version;
    }

    // keeps only addresses of the configured version, order preserved; null lists count as empty
    public Parsed parse(List<String> publicAddresses, List<String> privateAddresses) {
        return new Parsed(filter(publicAddresses), filter(privateAddresses));
    }

    private List<String> filter(List<String> addresses) {
        List<String> matched = new ArrayList<>();
        if (addresses == null) {
            return matched;
        }
        for (String address : addresses) {
            if (version.matches(address)) {
                matched.add(address);
            }
        }
        return matched;
    }

    public static class Parsed {
        private final List<String> publicAddresses, privateAddresses;

        Parsed(List<String> publicAddresses, List<String> privateAddresses) {
            this.publicAddresses = Collections.unmodifiableList(publicAddresses);
            this.privateAddresses = Collections.unmodifiableList(privateAddresses);
        }

        public List<String> publicAddresses() {
            return publicAddresses;
        }

        public List<String> privateAddresses() {
            return privateAddresses;
        }

        @Override
        public String toString() {
            return "public=" + publicAddresses + ", private=" + privateAddresses;
        }
    }
}

package com.envkit.openstack;

import java.util.regex.Pattern;

public enum IpVersion {
    V4(4) {
        @Override
        public boolean matches(String address) {
            if (address == null || !IPV4.matcher(address).matches()) {
                return false;
            }
            for (String octet : address.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return false;
                }
            }
            return true;
        }
    },
    V6(6) {
        @Override
        public boolean matches(String address) {
            if (address == null || !IPV6.matcher(address).matches()) {
                return false;
            }
            int doubleColon = address.indexOf("::");
            if (doubleColon >= 0 && address.indexOf("::", doubleColon + 1) >= 0) {
                return false;
            }
            String[] groups = address.split(":", -1);
            return doubleColon >= 0 ? groups.length <= 9 : groups.length == 8;
        }
    };

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    // hex groups and colons, zone ids not accepted
    private static final Pattern IPV6 = Pattern.compile("[0-9A-Fa-f:]*:[0-9A-Fa-f:]*");

    private final int number;

    IpVersion(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public abstract boolean matches(String address);

    public static IpVersion of(boolean useIpv6) {
        return useIpv6 ? V6 : V4;
    }
}

package com.envkit.openstack;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AddressParserTest {
    private final List<String> pubV4 = Arrays.asList("1.1.1.1", "2.2.2.2");
    private final List<String> pubV6 = Arrays.asList("1::1", "2::2");
    private final List<String> privV4 = Arrays.asList("3.3.3.3", "4.4.4.4");
    private final List<String> privV6 = Arrays.asList("3::3", "4::4");

    private static List<String> mixed(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>();
        // interleave so relative order actually matters
        for (int i = 0; i < Math.max(a.size(), b.size()); i++) {
            if (i < a.size()) all.add(a.get(i));
            if (i < b.size()) all.add(b.get(i));
        }
        return all;
    }

    @Test
    public void v4KeepsOnlyV4InOrder() {
        AddressParser.Parsed parsed = new AddressParser(IpVersion.V4).parse(mixed(pubV6, pubV4), mixed(privV4, privV6));
        assertEquals(pubV4, parsed.publicAddresses());
        assertEquals(privV4, parsed.privateAddresses());
    }

    @Test
    public void v6KeepsOnlyV6InOrder() {
        AddressParser.Parsed parsed = new AddressParser(IpVersion.V6).parse(mixed(pubV4, pubV6), mixed(privV6, privV4));
        assertEquals(pubV6, parsed.publicAddresses());
        assertEquals(privV6, parsed.privateAddresses());
    }

    @Test
    public void onlyPublicAddresses() {
        AddressParser.Parsed parsed = new AddressParser(IpVersion.V4).parse(mixed(pubV4, pubV6), null);
        assertEquals(pubV4, parsed.publicAddresses());
        assertEquals(Collections.emptyList(), parsed.privateAddresses());
    }

    @Test
    public void onlyPrivateAddresses() {
        AddressParser.Parsed parsed = new AddressParser(IpVersion.V6).parse(null, mixed(privV4, privV6));
        assertEquals(Collections.emptyList(), parsed.publicAddresses());
        assertEquals(privV6, parsed.privateAddresses());
    }

    @Test
    public void absentInputGivesEmptyLists() {
        for (IpVersion version : IpVersion.values()) {
            AddressParser.Parsed parsed = new AddressParser(version).parse(null, null);
            assertTrue(parsed.publicAddresses().isEmpty());
            assertTrue(parsed.privateAddresses().isEmpty());
        }
    }

    @Test
    public void versionSyntax() {
        assertTrue(IpVersion.V4.matches("192.168.0.1"));
        assertFalse(IpVersion.V4.matches("256.1.1.1"));
        assertFalse(IpVersion.V4.matches("1.2.3"));
        assertFalse(IpVersion.V4.matches("example.com"));
        assertTrue(IpVersion.V6.matches("2001:db8::8a2e:370:7334"));
        assertTrue(IpVersion.V6.matches("::1"));
        assertTrue(IpVersion.V6.matches("1:2:3:4:5:6:7:8"));
        assertFalse(IpVersion.V6.matches("1::2::3"));
        assertFalse(IpVersion.V6.matches("1.1.1.1"));
        assertFalse(IpVersion.V6.matches(null));
    }
}

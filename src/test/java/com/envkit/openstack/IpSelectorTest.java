package com.envkit.openstack;

import com.envkit.devops.AddressUnavailableException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.envkit.openstack.FakeServer.v4;
import static com.envkit.openstack.FakeServer.v6;
import static org.junit.jupiter.api.Assertions.*;

public class IpSelectorTest {
    private final IpSelector v4Selector = new IpSelector(new AddressParser(IpVersion.V4), null);

    @Test
    public void prefersFirstPublicAddress() throws Exception {
        FakeServer server = new FakeServer().publicIps("1::1", "1.2.3.4").privateIps("5.5.5.5");
        assertEquals("1.2.3.4", v4Selector.select(server));
    }

    @Test
    public void onlyPublicAddresses() throws Exception {
        FakeServer server = new FakeServer().publicIps("4.3.2.1", "2::1");
        assertEquals("4.3.2.1", v4Selector.select(server));
    }

    @Test
    public void fallsBackToPrivateAddress() throws Exception {
        FakeServer server = new FakeServer().privateIps("3::1", "5.5.5.5");
        assertEquals("5.5.5.5", v4Selector.select(server));
    }

    @Test
    public void usesFlatListWithoutPredictableNetworkNames() throws Exception {
        FakeServer server = new FakeServer().allIps("3::1", "5.5.5.5");
        assertEquals("5.5.5.5", v4Selector.select(server));
    }

    @Test
    public void ipv6WhenConfigured() throws Exception {
        IpSelector selector = new IpSelector(new AddressParser(IpVersion.V6), null);
        FakeServer server = new FakeServer().publicIps("1.2.3.4", "1::1").privateIps("5::5");
        assertEquals("1::1", selector.select(server));
    }

    @Test
    public void userDefinedNetworkGroup() throws Exception {
        IpSelector selector = new IpSelector(new AddressParser(IpVersion.V4), "mynetwork");
        FakeServer server = new FakeServer()
                .group("mynetwork", v6("4::1"), v4("7.7.7.7"))
                .publicIps("1.2.3.4");
        assertEquals("7.7.7.7", selector.select(server));
    }

    @Test
    public void userDefinedNetworkGroupWithoutVersionTags() throws Exception {
        IpSelector selector = new IpSelector(new AddressParser(IpVersion.V4), "mynetwork");
        FakeServer server = new FakeServer().group("mynetwork",
                new com.envkit.devops.AddressEntry(0, "7.7.7.7"), new com.envkit.devops.AddressEntry(0, "4::1"));
        assertEquals("7.7.7.7", selector.select(server));
    }

    @Test
    public void missingNetworkGroupFallsThrough() throws Exception {
        IpSelector selector = new IpSelector(new AddressParser(IpVersion.V4), "elsewhere");
        FakeServer server = new FakeServer().group("mynetwork", v4("7.7.7.7")).publicIps("1.2.3.4");
        assertEquals("1.2.3.4", selector.select(server));
    }

    @Nested
    class WithoutFloatingIpExtension {
        @Test
        public void selectsFirstPublicFromGroups() throws Exception {
            FakeServer server = new FakeServer().withoutPublicPrivateLookup()
                    .group("public", v4("6.6.6.6"), v4("7.7.7.7"))
                    .group("private", v4("8.8.8.8"), v4("9.9.9.9"));
            assertEquals("6.6.6.6", v4Selector.select(server));
        }

        @Test
        public void onlyPublicGroup() throws Exception {
            FakeServer server = new FakeServer().withoutPublicPrivateLookup()
                    .group("public", v4("6.6.6.6"), v4("7.7.7.7"));
            assertEquals("6.6.6.6", v4Selector.select(server));
        }

        @Test
        public void onlyPrivateGroup() throws Exception {
            FakeServer server = new FakeServer().withoutPublicPrivateLookup()
                    .group("private", v4("8.8.8.8"), v4("9.9.9.9"));
            assertEquals("8.8.8.8", v4Selector.select(server));
        }

        @Test
        public void oddlyNamedGroupsUseTheFlatList() throws Exception {
            FakeServer server = new FakeServer().withoutPublicPrivateLookup()
                    .group("tenant-net", v4("10.0.0.4"))
                    .allIps("10.0.0.4");
            assertEquals("10.0.0.4", v4Selector.select(server));
        }
    }

    @Test
    public void noAddressAnywhere() {
        AddressUnavailableException e = assertThrows(AddressUnavailableException.class,
                () -> v4Selector.select(new FakeServer()));
        assertTrue(e.getMessage().contains("IPv4"));
    }

    @Test
    public void noAddressOfTheRequestedVersion() {
        FakeServer server = new FakeServer().publicIps("1::1").privateIps("2::2").allIps("1::1", "2::2");
        assertThrows(AddressUnavailableException.class, () -> v4Selector.select(server));
    }
}

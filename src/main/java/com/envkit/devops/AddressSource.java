package com.envkit.devops;

/* Address views of a server. Which ones carry data depends on the provider deployment. */

import java.util.List;
import java.util.Map;

public interface AddressSource {
    // network group name -> entries; empty map when the provider returned none
    Map<String, List<AddressEntry>> addressGroups();

    // capability probe: false when the deployment has no public/private address lookup at all
    boolean hasPublicPrivateAddresses() throws ProviderException;

    // only meaningful when hasPublicPrivateAddresses() is true
    List<String> publicAddresses();

    List<String> privateAddresses();

    // every address the server reports, regardless of network naming
    List<String> allAddresses();
}

package com.envkit.devops;

/* A live (or still provisioning) compute resource. Valid for a single create or destroy call. */

public interface ServerHandle extends AddressSource {
    String getId();

    String getName();

    // administrative password generated at boot, null when the provider did not return one
    String getAdminPassword();
}

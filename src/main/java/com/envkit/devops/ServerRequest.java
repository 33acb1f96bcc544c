package com.envkit.devops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameters of a single server creation, with every reference already resolved to a provider id.
 */
public class ServerRequest {
    private final String name, imageId, flavorId, keyName, publicKey, userData;
    private final List<String> securityGroups, networkIds;

    private ServerRequest(Builder b) {
        this.name = b.name;
        this.imageId = b.imageId;
        this.flavorId = b.flavorId;
        this.keyName = b.keyName;
        this.publicKey = b.publicKey;
        this.userData = b.userData;
        this.securityGroups = Collections.unmodifiableList(new ArrayList<>(b.securityGroups));
        this.networkIds = Collections.unmodifiableList(new ArrayList<>(b.networkIds));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public String getImageId() {
        return imageId;
    }

    public String getFlavorId() {
        return flavorId;
    }

    public String getKeyName() {
        return keyName;
    }

    // raw (not yet encoded) user data
    // injected into authorized_keys at boot when no keypair is named
    public String getPublicKey() {
        return publicKey;
    }

    public String getUserData() {
        return userData;
    }

    public List<String> getSecurityGroups() {
        return securityGroups;
    }

    public List<String> getNetworkIds() {
        return networkIds;
    }

    @Override
    public String toString() {
        return "ServerRequest[name=" + name + ", image=" + imageId + ", flavor=" + flavorId
                + ", keyName=" + keyName + ", publicKey=" + (publicKey != null ? "set" : "none")
                + ", securityGroups=" + securityGroups + ", networks=" + networkIds
                + ", userData=" + (userData != null ? userData.length() + " chars" : "none") + "]";
    }

    public static class Builder {
        private String name, imageId, flavorId, keyName, publicKey, userData;
        private final List<String> securityGroups = new ArrayList<>();
        private final List<String> networkIds = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder imageId(String imageId) {
            this.imageId = imageId;
            return this;
        }

        public Builder flavorId(String flavorId) {
            this.flavorId = flavorId;
            return this;
        }

        public Builder keyName(String keyName) {
            this.keyName = keyName;
            return this;
        }

        public Builder publicKey(String publicKey) {
            this.publicKey = publicKey;
            return this;
        }

        public Builder userData(String userData) {
            this.userData = userData;
            return this;
        }

        public Builder securityGroups(List<String> securityGroups) {
            this.securityGroups.addAll(securityGroups);
            return this;
        }

        public Builder networkId(String networkId) {
            this.networkIds.add(networkId);
            return this;
        }

        public ServerRequest build() {
            return new ServerRequest(this);
        }
    }
}

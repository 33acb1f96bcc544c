package com.envkit.devops;

// anything a provider lists with an id and a display name: images, flavors, networks
public class NamedResource {
    private final String id, name;

    public NamedResource(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + "(" + id + ")";
    }
}

package com.envkit.devops;

// one entry of a structured address group, e.g. {"version": 4, "addr": "10.0.0.5"}
public class AddressEntry {
    private final int version;
    private final String addr;

    public AddressEntry(int version, String addr) {
        this.version = version;
        this.addr = addr;
    }

    public int getVersion() {
        return version;
    }

    public String getAddr() {
        return addr;
    }

    @Override
    public String toString() {
        return "v" + version + ":" + addr;
    }
}

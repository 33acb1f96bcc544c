package com.envkit.devops;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-instance state that outlives a single run: the server id and the hostname it is reached on.
 * Not thread safe; create and destroy on the same state have to be serialized by the caller.
 */
public class InstanceState {
    public static final String SERVER_ID = "server_id";
    public static final String HOSTNAME = "hostname";

    private final Map<String, String> values = new LinkedHashMap<>();
    private final StateStore store;

    public InstanceState() {
        this(Collections.emptyMap(), StateStore.NONE);
    }

    public InstanceState(Map<String, String> initial, StateStore store) {
        this.values.putAll(initial);
        this.store = store;
    }

    public String getServerId() {
        return values.get(SERVER_ID);
    }

    public void setServerId(String serverId) {
        put(SERVER_ID, serverId);
    }

    public String getHostname() {
        return values.get(HOSTNAME);
    }

    public void setHostname(String hostname) {
        put(HOSTNAME, hostname);
    }

    // drops both keys, persisting once
    public void clear() {
        values.remove(SERVER_ID);
        values.remove(HOSTNAME);
        store.save(asMap());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    private void put(String key, String value) {
        values.put(key, value);
        store.save(asMap());
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

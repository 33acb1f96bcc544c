package com.envkit.devops;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InstanceStateTest {
    private final List<Map<String, String>> saved = new ArrayList<>();
    private final StateStore store = saved::add;

    @Test
    public void startsEmpty() {
        InstanceState state = new InstanceState();
        assertTrue(state.isEmpty());
        assertNull(state.getServerId());
        assertNull(state.getHostname());
    }

    @Test
    public void savesOnEveryChange() {
        InstanceState state = new InstanceState(Collections.emptyMap(), store);
        state.setServerId("test123");
        state.setHostname("1.2.3.4");
        assertEquals(2, saved.size());
        assertEquals(Collections.singletonMap(InstanceState.SERVER_ID, "test123"), saved.get(0));
        assertEquals("1.2.3.4", saved.get(1).get(InstanceState.HOSTNAME));
    }

    @Test
    public void clearRemovesBothKeysAndKeepsOthers() {
        InstanceState state = new InstanceState(Map.of("server_id", "1", "hostname", "h", "last_action", "create"), store);
        state.clear();
        assertNull(state.getServerId());
        assertNull(state.getHostname());
        assertEquals(Map.of("last_action", "create"), state.asMap());
        assertEquals(1, saved.size());
    }

    @Test
    public void mapViewIsReadOnly() {
        InstanceState state = new InstanceState();
        state.setServerId("x");
        assertThrows(UnsupportedOperationException.class, () -> state.asMap().put("hostname", "h"));
    }
}

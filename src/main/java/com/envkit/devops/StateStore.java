package com.envkit.devops;

import java.util.Map;

public interface StateStore {
    // called after every change so a crash mid-create still leaves something to destroy
    void save(Map<String, String> state);

    StateStore NONE = state -> { };
}

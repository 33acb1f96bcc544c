package com.envkit.cli;

import com.envkit.devops.StateStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

// instance state as a small JSON object, rewritten on every change
public class JsonStateStore implements StateStore {
    final static Logger LOG = LogManager.getLogger(JsonStateStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final File file;

    public JsonStateStore(File file) {
        this.file = file;
    }

    public Map<String, String> load() throws IOException {
        if (!file.exists()) {
            return new LinkedHashMap<>();
        }
        return MAPPER.readValue(file, new TypeReference<LinkedHashMap<String, String>>() { });
    }

    @Override
    public void save(Map<String, String> state) {
        try {
            File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                throw new IOException("Cannot create " + parent);
            }
            MAPPER.writeValue(file, state);
            LOG.debug("Saved state " + state + " to " + file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write state file " + file, e);
        }
    }
}

package com.envkit.devops;

import software.amazon.awssdk.utils.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Read-only view of the driver settings. The supplied {@link Properties} are copied once, so later
 * changes by the caller are not seen during a lifecycle run.
 */
public class InstanceConfig {
    public static final String OPENSTACK_USERNAME = "openstack_username";
    public static final String OPENSTACK_API_KEY = "openstack_api_key";
    public static final String OPENSTACK_AUTH_URL = "openstack_auth_url";
    public static final String OPENSTACK_TENANT = "openstack_tenant";
    public static final String OPENSTACK_REGION = "openstack_region";
    public static final String OPENSTACK_SERVICE_NAME = "openstack_service_name";
    public static final String IMAGE_REF = "image_ref";
    public static final String FLAVOR_REF = "flavor_ref";
    public static final String NETWORK_REF = "network_ref";
    public static final String SERVER_NAME = "server_name";
    public static final String KEY_NAME = "key_name";
    public static final String SECURITY_GROUPS = "security_groups";
    public static final String USERNAME = "username";
    public static final String PORT = "port";
    public static final String PRIVATE_KEY_PATH = "private_key_path";
    public static final String PUBLIC_KEY_PATH = "public_key_path";
    public static final String FLOATING_IP_POOL = "floating_ip_pool";
    public static final String FLOATING_IP = "floating_ip";
    public static final String NETWORK_NAME = "openstack_network_name";
    public static final String USE_IPV6 = "use_ipv6";
    public static final String DISABLE_SSL_VALIDATION = "disable_ssl_validation";
    public static final String USER_DATA = "user_data";
    public static final String READY_TIMEOUT = "ready_timeout";
    public static final String SSH_TIMEOUT = "ssh_timeout";

    public static final List<String> REQUIRED_SERVER_SETTINGS =
            Collections.unmodifiableList(Arrays.asList(OPENSTACK_USERNAME, OPENSTACK_API_KEY, OPENSTACK_AUTH_URL));
    public static final List<String> OPTIONAL_SERVER_SETTINGS =
            Collections.unmodifiableList(Arrays.asList(OPENSTACK_TENANT, OPENSTACK_REGION, OPENSTACK_SERVICE_NAME));

    public static final String DEFAULT_USERNAME = "root";
    public static final int DEFAULT_PORT = 22;
    public static final int DEFAULT_READY_TIMEOUT = 300;
    public static final int DEFAULT_SSH_TIMEOUT = 150;

    private final Properties params = new Properties();
    private final String privateKeyPath, publicKeyPath;

    public InstanceConfig(Properties p) {
        this(p, new LocalEnvironment());
    }

    public InstanceConfig(Properties p, EnvironmentProbe env) {
        for (String key : p.stringPropertyNames()) {
            String value = p.getProperty(key);
            if (!StringUtils.isBlank(value)) {
                params.setProperty(key, value.trim());
            }
        }
        this.privateKeyPath = params.containsKey(PRIVATE_KEY_PATH)
                ? params.getProperty(PRIVATE_KEY_PATH)
                : defaultKeyPath(env.userHome());
        this.publicKeyPath = params.containsKey(PUBLIC_KEY_PATH)
                ? params.getProperty(PUBLIC_KEY_PATH)
                : (privateKeyPath == null ? null : privateKeyPath + ".pub");
    }

    // RSA preferred over DSA when both exist
    private static String defaultKeyPath(Path home) {
        if (home == null) {
            return null;
        }
        for (String name : new String[]{"id_rsa", "id_dsa"}) {
            Path key = home.resolve(".ssh").resolve(name);
            if (Files.exists(key)) {
                return key.toString();
            }
        }
        return null;
    }

    public String get(String key) {
        return params.getProperty(key);
    }

    public boolean has(String key) {
        return params.containsKey(key);
    }

    public List<String> missingRequiredSettings() {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_SERVER_SETTINGS) {
            if (!has(key)) {
                missing.add(key);
            }
        }
        return missing;
    }

    // connection settings handed to the provider binding, required ones first
    public Map<String, String> serverSettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        for (String key : REQUIRED_SERVER_SETTINGS) {
            if (has(key)) settings.put(key, get(key));
        }
        for (String key : OPTIONAL_SERVER_SETTINGS) {
            if (has(key)) settings.put(key, get(key));
        }
        return settings;
    }

    public String getImageRef() {
        return get(IMAGE_REF);
    }

    public String getFlavorRef() {
        return get(FLAVOR_REF);
    }

    public List<String> getNetworkRefs() {
        return splitList(get(NETWORK_REF));
    }

    public String getServerName() {
        return get(SERVER_NAME);
    }

    public String getKeyName() {
        return get(KEY_NAME);
    }

    public List<String> getSecurityGroups() {
        return splitList(get(SECURITY_GROUPS));
    }

    public String getUsername() {
        return params.getProperty(USERNAME, DEFAULT_USERNAME);
    }

    public int getPort() {
        return getInt(PORT, DEFAULT_PORT);
    }

    public String getPrivateKeyPath() {
        return privateKeyPath;
    }

    public String getPublicKeyPath() {
        return publicKeyPath;
    }

    public String getFloatingIpPool() {
        return get(FLOATING_IP_POOL);
    }

    public String getFloatingIp() {
        return get(FLOATING_IP);
    }

    public String getNetworkName() {
        return get(NETWORK_NAME);
    }

    public boolean useIpv6() {
        return Boolean.parseBoolean(get(USE_IPV6));
    }

    public boolean disableSslValidation() {
        return Boolean.parseBoolean(get(DISABLE_SSL_VALIDATION));
    }

    public String getUserDataPath() {
        return get(USER_DATA);
    }

    public int getReadyTimeout() {
        return getInt(READY_TIMEOUT, DEFAULT_READY_TIMEOUT);
    }

    public int getSshTimeout() {
        return getInt(SSH_TIMEOUT, DEFAULT_SSH_TIMEOUT);
    }

    private int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " must be a number, got '" + value + "'", e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String item : value.split(",")) {
            if (!StringUtils.isBlank(item)) {
                items.add(item.trim());
            }
        }
        return items;
    }
}

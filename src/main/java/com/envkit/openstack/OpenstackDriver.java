package com.envkit.openstack;

import com.envkit.devops.*;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import software.amazon.awssdk.utils.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Creates and destroys the single server behind one test instance.
 *
 * <p>Create walks {@link LifecycleStage} from UNPROVISIONED to BOOTSTRAPPED and persists the server id and the
 * hostname the moment each is known, so that a failure at any later step still leaves enough state for
 * {@link #destroy(InstanceState)} to clean up. Nothing is rolled back and nothing is retried here.
 *
 * <p>Destroy is idempotent: without a server id it does not touch the provider at all; with one it deletes the
 * server if it still exists and then always forgets both state keys.
 */
public class OpenstackDriver {
    final static Logger LOG = LogManager.getLogger(OpenstackDriver.class);

    private final String instanceName;
    private final InstanceConfig config;
    private final CloudProviderFactory providerFactory;
    private final NameGenerator nameGenerator;
    private final ShellWaiter shellWaiter;
    private final ReferenceResolver resolver = new ReferenceResolver();
    private final BootstrapScripts scripts = new BootstrapScripts();
    private LifecycleStage stage = LifecycleStage.UNPROVISIONED;

    public OpenstackDriver(String instanceName, InstanceConfig config, CloudProviderFactory providerFactory) {
        this(instanceName, config, providerFactory, new LocalEnvironment(), new SshdWaiter());
    }

    public OpenstackDriver(String instanceName, InstanceConfig config, CloudProviderFactory providerFactory,
                           EnvironmentProbe env, ShellWaiter shellWaiter) {
        this.instanceName = instanceName;
        this.config = config;
        this.providerFactory = providerFactory;
        this.nameGenerator = new NameGenerator(env);
        this.shellWaiter = shellWaiter;
    }

    public LifecycleStage getStage() {
        return stage;
    }

    public void create(InstanceState state) throws ActionFailedException {
        stage = LifecycleStage.UNPROVISIONED;
        try {
            validateCredentials();
            validateSettings();
            String publicKey = readPublicKey();
            CloudProviderInterface provider = connect();

            ServerRequest request = buildServerRequest(provider, publicKey);
            LOG.info("Creating " + request);
            ServerHandle server = provider.createServer(request);
            state.setServerId(server.getId());
            stage = LifecycleStage.REQUESTED;
            // only the boot response carries the generated password
            String adminPassword = server.getAdminPassword();
            LOG.info("OpenStack instance <" + server.getId() + "> created.");

            server = provider.waitForActive(server.getId(), config.getReadyTimeout());
            LOG.info("OpenStack instance <" + server.getId() + "> is active");

            String hostname = assignAddress(provider, server);
            state.setHostname(hostname);
            stage = LifecycleStage.ADDRESS_ASSIGNED;

            shellWaiter.waitForShell(hostname, config.getPort(), config.getSshTimeout());
            stage = LifecycleStage.SHELL_READY;

            SshCredentials admin = adminCredentials(adminPassword);
            runCommands(provider, hostname, admin, scripts.keySetup(publicKey, config.getUsername()));
            runCommands(provider, hostname, admin, scripts.hints());
            stage = LifecycleStage.BOOTSTRAPPED;
            LOG.info("OpenStack instance <" + server.getId() + "> ready at " + hostname);
        } catch (ActionFailedException e) {
            LOG.error("Create of " + instanceName + " failed after " + stage + ": " + e.getMessage());
            throw e;
        }
    }

    public void destroy(InstanceState state) throws ActionFailedException {
        String serverId = state.getServerId();
        if (serverId == null) {
            LOG.info("No server recorded for " + instanceName + ", nothing to destroy");
            return;
        }
        validateCredentials();
        ProviderException failure = null;
        try {
            CloudProviderInterface provider = connect();
            ServerHandle server = provider.getServer(serverId);
            if (server == null) {
                LOG.info("OpenStack instance <" + serverId + "> no longer exists");
            } else {
                provider.deleteServer(serverId);
                LOG.info("OpenStack instance <" + serverId + "> destroyed.");
            }
        } catch (ProviderException e) {
            failure = e;
            throw e;
        } finally {
            forget(state, failure);
        }
    }

    // a failing state write must not replace the provider error
    private void forget(InstanceState state, ProviderException failure) {
        try {
            state.clear();
        } catch (UncheckedIOException e) {
            if (failure == null) {
                throw e;
            }
            LOG.error("Could not clear state after failed destroy: " + e.getMessage());
            failure.addSuppressed(e);
        }
    }

    // partial credentials are always an error
    void validateCredentials() throws ConfigurationInvalidException {
        List<String> missing = config.missingRequiredSettings();
        if (!missing.isEmpty()) {
            throw new ConfigurationInvalidException("Missing required OpenStack settings: " + missing);
        }
    }

    void validateSettings() throws ConfigurationInvalidException {
        try {
            config.getPort();
            config.getReadyTimeout();
            config.getSshTimeout();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationInvalidException(e.getMessage());
        }
    }

    private CloudProviderInterface connect() throws ProviderException {
        if (config.disableSslValidation()) {
            LOG.warn("SSL certificate validation disabled");
        }
        LOG.debug("Connecting with " + config.serverSettings().keySet());
        return providerFactory.connect(config);
    }

    String defaultName() {
        return nameGenerator.generate(instanceName);
    }

    ServerRequest buildServerRequest(CloudProviderInterface provider, String publicKey) throws ProviderException {
        String name = config.getServerName();
        if (name == null) {
            name = defaultName();
            LOG.info("Generated server name " + name);
        }
        ServerRequest.Builder builder = ServerRequest.builder()
                .name(name)
                .keyName(config.getKeyName())
                .publicKey(publicKey.trim())
                .securityGroups(config.getSecurityGroups());
        if (config.getImageRef() != null) {
            builder.imageId(resolver.resolve(config.getImageRef(), provider.listImages()));
        }
        if (config.getFlavorRef() != null) {
            builder.flavorId(resolver.resolve(config.getFlavorRef(), provider.listFlavors()));
        }
        List<String> networkRefs = config.getNetworkRefs();
        if (!networkRefs.isEmpty()) {
            List<NamedResource> networks = provider.listNetworks();
            for (String ref : networkRefs) {
                builder.networkId(resolver.resolve(ref, networks));
            }
        }
        builder.userData(readUserData());
        return builder.build();
    }

    private String assignAddress(CloudProviderInterface provider, ServerHandle server) throws ActionFailedException {
        FloatingIpAllocator allocator = new FloatingIpAllocator(provider);
        if (config.getFloatingIp() != null) {
            return allocator.attach(server, config.getFloatingIp());
        }
        if (config.getFloatingIpPool() != null) {
            return allocator.attachFromPool(server, config.getFloatingIpPool());
        }
        IpSelector selector = new IpSelector(new AddressParser(IpVersion.of(config.useIpv6())), config.getNetworkName());
        return selector.select(server);
    }

    private SshCredentials adminCredentials(String adminPassword) {
        if (!StringUtils.isEmpty(adminPassword)) {
            return SshCredentials.password(config.getUsername(), adminPassword);
        }
        return SshCredentials.privateKey(config.getUsername(), config.getPrivateKeyPath());
    }

    private void runCommands(CloudProviderInterface provider, String hostname, SshCredentials credentials,
                             List<String> commands) throws ProviderException {
        try (RemoteShell shell = provider.openShell(hostname, config.getPort(), credentials)) {
            for (String command : commands) {
                shell.run(command);
            }
        }
    }

    private String readPublicKey() throws ConfigurationInvalidException {
        String path = config.getPublicKeyPath();
        if (path == null || !Files.exists(Paths.get(path))) {
            throw new ConfigurationInvalidException("No public key found (public_key_path=" + path + ")");
        }
        try {
            return Files.readString(Paths.get(path));
        } catch (IOException e) {
            throw new ConfigurationInvalidException("Cannot read public key " + path + ": " + e.getMessage());
        }
    }

    private String readUserData() {
        String path = config.getUserDataPath();
        if (path == null) {
            return null;
        }
        Path file = Paths.get(path);
        if (!Files.exists(file)) {
            LOG.warn("User data file " + path + " does not exist, booting without it");
            return null;
        }
        try {
            return Files.readString(file);
        } catch (IOException e) {
            LOG.warn("Could not read user data " + path + ": " + e.getMessage());
            return null;
        }
    }
}

package com.envkit.openstack;

import com.envkit.devops.CloudProviderFactory;
import com.envkit.devops.CloudProviderInterface;
import com.envkit.devops.InstanceConfig;
import com.envkit.devops.ProviderException;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.openstack4j.api.OSClient;
import org.openstack4j.api.client.IOSClientBuilder;
import org.openstack4j.api.exceptions.OS4JException;
import org.openstack4j.core.transport.Config;
import org.openstack4j.openstack.OSFactory;

public class OpenstackProviderFactory implements CloudProviderFactory {
    final static Logger LOG = LogManager.getLogger(OpenstackProviderFactory.class);
    private static final int TIMEOUT_MS = 20000;

    @Override
    public CloudProviderInterface connect(InstanceConfig config) throws ProviderException {
        Config osConfig = Config.newConfig()
                .withConnectionTimeout(TIMEOUT_MS)
                .withReadTimeout(TIMEOUT_MS);
        if (config.disableSslValidation()) {
            osConfig = osConfig.withSSLVerificationDisabled();
        }
        IOSClientBuilder.V2 builder = OSFactory.builderV2()
                .endpoint(config.get(InstanceConfig.OPENSTACK_AUTH_URL))
                .credentials(config.get(InstanceConfig.OPENSTACK_USERNAME), config.get(InstanceConfig.OPENSTACK_API_KEY))
                .withConfig(osConfig);
        if (config.has(InstanceConfig.OPENSTACK_TENANT)) {
            builder = builder.tenantName(config.get(InstanceConfig.OPENSTACK_TENANT));
        }
        if (config.has(InstanceConfig.OPENSTACK_SERVICE_NAME)) {
            // openstack4j picks the compute endpoint by service type from the catalog
            LOG.info("Service name " + config.get(InstanceConfig.OPENSTACK_SERVICE_NAME) + " noted, endpoint chosen by type");
        }
        try {
            OSClient<?> os = builder.authenticate();
            if (config.has(InstanceConfig.OPENSTACK_REGION)) {
                os = os.useRegion(config.get(InstanceConfig.OPENSTACK_REGION));
            }
            LOG.info("Connected to " + config.get(InstanceConfig.OPENSTACK_AUTH_URL) + " as " + config.get(InstanceConfig.OPENSTACK_USERNAME));
            return new OpenstackCloudProvider(os);
        } catch (OS4JException e) {
            throw new ProviderException("OpenStack login failed: " + e.getMessage(), e);
        }
    }
}

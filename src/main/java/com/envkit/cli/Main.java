package com.envkit.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.envkit.devops.ActionFailedException;
import com.envkit.devops.InstanceConfig;
import com.envkit.devops.InstanceState;
import com.envkit.openstack.OpenstackDriver;
import com.envkit.openstack.OpenstackProviderFactory;
import org.apache.log4j.*;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Properties;

public class Main {
    final static Logger LOG = LogManager.getLogger(Main.class);

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    static int run(String[] argv) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder()
                .addObject(args)
                .programName("openstack-instance-driver")
                .build();
        try {
            jc.parse(argv);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jc.usage();
            return 2;
        }
        if (args.help || args.actions.size() != 1) {
            jc.usage();
            return args.help ? 0 : 2;
        }
        setupLogging(args.debug ? Level.DEBUG : Level.INFO);

        String action = args.actions.get(0);
        try {
            Properties params = new Properties();
            LOG.info("Reading properties from " + args.propertiesFile);
            try (Reader reader = new FileReader(args.propertiesFile)) {
                params.load(reader);
            }
            JsonStateStore store = new JsonStateStore(new File(args.stateFile));
            InstanceState state = new InstanceState(store.load(), store);
            OpenstackDriver driver = new OpenstackDriver(args.instanceName, new InstanceConfig(params), new OpenstackProviderFactory());
            if ("create".equals(action)) {
                driver.create(state);
            } else if ("destroy".equals(action)) {
                driver.destroy(state);
            } else {
                LOG.error("Unknown action " + action + ", expected create or destroy");
                return 2;
            }
            LOG.info(action + " finished, state: " + state);
            return 0;
        } catch (ActionFailedException | IOException | UncheckedIOException e) {
            LOG.error(action + " failed: " + e.getMessage(), e);
            return 1;
        }
    }

    static void setupLogging(Level level) {
        //This is the root logger provided by log4j
        Logger rootLogger = Logger.getRootLogger();
        rootLogger.setLevel(level);
        rootLogger.removeAllAppenders();
        //Define log pattern layout
        PatternLayout layout = new PatternLayout("%d{ISO8601} [%t] %-5p %c %x - %m%n");
        //Add console appender to root logger
        rootLogger.addAppender(new ConsoleAppender(layout));
    }
}

package org.endlesssource.omxstore.examples;

import org.endlesssource.omxstore.OmxStoreDeployments;
import org.endlesssource.omxstore.OmxStoreDumper;
import org.endlesssource.omxstore.OmxStoreFactory;
import org.endlesssource.omxstore.api.OmxStore;
import org.endlesssource.omxstore.api.OmxStoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Loads both deployments and prints them.
 * Usage: {@code OmxStoreDumpExample [config-file]}
 */
public final class OmxStoreDumpExample {
    private static final Logger logger = LoggerFactory.getLogger(OmxStoreDumpExample.class);

    public static void main(String[] args) {
        logger.info("Discovered providers: {}", OmxStoreFactory.getDiscoveredProviders());
        logger.info("Available providers: {}", OmxStoreFactory.getAvailableProviders());

        OmxStoreOptions options = OmxStoreOptions.defaults();
        if (args.length > 0) {
            options = options.withConfigFile(Path.of(args[0]));
        }

        OmxStoreDeployments deployments = OmxStoreFactory.createDeployments(options);
        for (OmxStore store : deployments.all()) {
            System.out.print(OmxStoreDumper.dump(store));
        }
    }

    private OmxStoreDumpExample() {
    }
}

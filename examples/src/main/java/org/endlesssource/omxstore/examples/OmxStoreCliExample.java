package org.endlesssource.omxstore.examples;

import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.OmxStoreDeployments;
import org.endlesssource.omxstore.OmxStoreFactory;
import org.endlesssource.omxstore.api.OmxStoreOptions;

import java.nio.file.Path;
import java.util.Scanner;

/**
 * Interactive inspector for the store deployments.
 * Usage: {@code OmxStoreCliExample [config-file]}
 */
public final class OmxStoreCliExample {

    public static void main(String[] args) {
        OmxStoreOptions options = OmxStoreOptions.defaults();
        if (args.length > 0) {
            options = options.withConfigFile(Path.of(args[0]));
        }

        OmxStoreDeployments deployments;
        try {
            deployments = OmxStoreFactory.createDeployments(options);
        } catch (OmxStoreConfigException e) {
            System.err.println("Store configuration failed: " + e.getMessage());
            return;
        }

        OmxStoreShell shell = new OmxStoreShell(deployments, System.out);
        try (Scanner scanner = new Scanner(System.in)) {
            System.out.println("OMX Store CLI");
            shell.printHelp();
            while (true) {
                System.out.print(shell.selected().getInstanceName() + "> ");
                if (!scanner.hasNextLine()) {
                    break;
                }
                if (!shell.execute(scanner.nextLine())) {
                    return;
                }
            }
        }
    }

    private OmxStoreCliExample() {
    }
}

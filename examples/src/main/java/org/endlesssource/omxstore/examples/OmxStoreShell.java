package org.endlesssource.omxstore.examples;

import org.endlesssource.omxstore.OmxStoreDeployments;
import org.endlesssource.omxstore.OmxStoreDumper;
import org.endlesssource.omxstore.api.Attribute;
import org.endlesssource.omxstore.api.NodeInfo;
import org.endlesssource.omxstore.api.Omx;
import org.endlesssource.omxstore.api.OmxStore;
import org.endlesssource.omxstore.api.RoleInfo;
import org.endlesssource.omxstore.api.ServiceAttributes;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Command interpreter behind {@link OmxStoreCliExample}.
 */
final class OmxStoreShell {
    private final OmxStoreDeployments deployments;
    private final PrintStream out;
    private OmxStore selected;

    OmxStoreShell(OmxStoreDeployments deployments, PrintStream out) {
        this.deployments = deployments;
        this.out = out;
        this.selected = deployments.platform();
    }

    OmxStore selected() {
        return selected;
    }

    /**
     * @return false when the shell should exit
     */
    boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String[] parts = trimmed.split("\\s+", 2);
        String cmd = parts[0].toLowerCase();
        String arg = parts.length > 1 ? parts[1].trim() : "";

        switch (cmd) {
            case "help" -> printHelp();
            case "quit", "exit" -> {
                return false;
            }
            case "instances" -> printInstances();
            case "use" -> use(arg);
            case "prefix" -> out.println(selected.getNodePrefix());
            case "attrs" -> printServiceAttributes();
            case "roles" -> printRoles();
            case "role" -> printRole(arg);
            case "find" -> find(arg);
            case "omx" -> printOmx(arg);
            case "dump" -> out.print(OmxStoreDumper.dump(selected));
            default -> out.println("Unknown command: " + cmd + " (type 'help')");
        }
        return true;
    }

    void printHelp() {
        out.println("Commands:");
        out.println("  help                      Show this help");
        out.println("  instances                 List store deployments");
        out.println("  use <instance>            Select a deployment (platform, vendor)");
        out.println("  prefix                    Show the node prefix");
        out.println("  attrs                     List service attributes");
        out.println("  roles                     List roles");
        out.println("  role <role>               Show nodes of a role in preference order");
        out.println("  find <type> [encoder]     Show nodes for a media type");
        out.println("  omx <provider>            Resolve a node provider");
        out.println("  dump                      Dump the selected deployment");
        out.println("  exit                      Quit");
    }

    private void printInstances() {
        for (String name : deployments.instanceNames()) {
            String marker = name.equals(selected.getInstanceName()) ? "*" : " ";
            out.printf("%s %s%n", marker, name);
        }
    }

    private void use(String arg) {
        if (arg.isEmpty()) {
            out.println("Usage: use <instance>");
            return;
        }
        Optional<OmxStore> store = deployments.get(arg);
        if (store.isEmpty()) {
            out.println("No deployment named " + arg);
            return;
        }
        selected = store.get();
        out.println("Selected: " + selected.getInstanceName());
    }

    private void printServiceAttributes() {
        ServiceAttributes attributes = selected.listServiceAttributes();
        if (!attributes.isOk()) {
            out.println("Service attributes unavailable: " + attributes.status());
            return;
        }
        if (attributes.attributes().isEmpty()) {
            out.println("No service attributes.");
            return;
        }
        for (Attribute attribute : attributes.attributes()) {
            out.println(attribute.key() + " = " + attribute.value());
        }
    }

    private void printRoles() {
        List<RoleInfo> roles = selected.listRoles();
        if (roles.isEmpty()) {
            out.println("No roles.");
            return;
        }
        for (int i = 0; i < roles.size(); i++) {
            RoleInfo role = roles.get(i);
            out.printf("[%d] %s (%s, %d nodes)%n", i, role.role(), role.type(), role.nodes().size());
        }
    }

    private void printRole(String arg) {
        if (arg.isEmpty()) {
            out.println("Usage: role <role>");
            return;
        }
        for (RoleInfo role : selected.listRoles()) {
            if (role.role().equals(arg)) {
                printNodes(role);
                return;
            }
        }
        out.println("No role named " + arg);
    }

    private void find(String arg) {
        if (arg.isEmpty()) {
            out.println("Usage: find <type> [encoder]");
            return;
        }
        String[] parts = arg.split("\\s+");
        String type = parts[0];
        boolean encoder = parts.length > 1 && parts[1].equalsIgnoreCase("encoder");
        boolean found = false;
        for (RoleInfo role : selected.listRoles()) {
            if (role.type().equalsIgnoreCase(type) && role.isEncoder() == encoder) {
                out.println(role.role() + ":");
                printNodes(role);
                found = true;
            }
        }
        if (!found) {
            out.println("No " + (encoder ? "encoder" : "decoder") + " for " + type);
        }
    }

    private void printNodes(RoleInfo role) {
        if (role.nodes().isEmpty()) {
            out.println("  No nodes.");
            return;
        }
        for (int i = 0; i < role.nodes().size(); i++) {
            NodeInfo node = role.nodes().get(i);
            out.printf("  %d. %s (owner %s)%n", i + 1, node.name(), node.owner());
        }
    }

    private void printOmx(String arg) {
        if (arg.isEmpty()) {
            out.println("Usage: omx <provider>");
            return;
        }
        Omx omx = selected.getOmx(arg);
        if (omx == null) {
            out.println("Provider not found: " + arg);
            return;
        }
        out.println(omx.getName() + ": " + omx.listNodes().size() + " nodes");
        for (String node : omx.listNodes()) {
            out.println("  " + node);
        }
    }
}

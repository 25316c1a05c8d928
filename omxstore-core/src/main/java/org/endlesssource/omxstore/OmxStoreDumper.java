package org.endlesssource.omxstore;

import org.endlesssource.omxstore.api.Attribute;
import org.endlesssource.omxstore.api.NodeInfo;
import org.endlesssource.omxstore.api.OmxStore;
import org.endlesssource.omxstore.api.RoleInfo;
import org.endlesssource.omxstore.api.ServiceAttributes;

import java.util.List;
import java.util.Objects;

/**
 * Renders the content of a store as indented text.
 */
public final class OmxStoreDumper {

    private OmxStoreDumper() {
    }

    public static String dump(OmxStore store) {
        Objects.requireNonNull(store, "store must not be null");
        StringBuilder out = new StringBuilder();
        out.append("store ").append(store.getInstanceName()).append('\n');
        out.append("  prefix: ").append(store.getNodePrefix()).append('\n');

        ServiceAttributes attributes = store.listServiceAttributes();
        out.append("  service attributes (").append(attributes.status()).append("):\n");
        appendAttributes(out, attributes.attributes(), "    ");

        List<RoleInfo> roles = store.listRoles();
        out.append("  roles: ").append(roles.size()).append('\n');
        for (RoleInfo role : roles) {
            out.append("    ").append(role.role())
                    .append(" type=").append(role.type())
                    .append(role.isEncoder() ? " encoder" : " decoder")
                    .append(" preferPlatformNodes=").append(role.preferPlatformNodes())
                    .append('\n');
            for (NodeInfo node : role.nodes()) {
                String resolved = store.getOmx(node.owner()) != null ? "" : " (unresolved)";
                out.append("      ").append(node.name())
                        .append(" owner=").append(node.owner()).append(resolved).append('\n');
                appendAttributes(out, node.attributes(), "        ");
            }
        }
        return out.toString();
    }

    private static void appendAttributes(StringBuilder out, List<Attribute> attributes, String indent) {
        for (Attribute attribute : attributes) {
            out.append(indent).append(attribute.key()).append(" = ").append(attribute.value()).append('\n');
        }
    }
}

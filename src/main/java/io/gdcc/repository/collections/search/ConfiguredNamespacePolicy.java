package io.gdcc.repository.collections.search;

import io.gdcc.repository.collections.config.CollectionsConfig;
import io.gdcc.repository.collections.repository.Pid;
import java.util.Set;

/**
 * Namespace policy from {@link CollectionsConfig}: everything is accessible unless restriction is
 * on, then only PIDs in an allowed namespace. Malformed PIDs are never accessible while
 * restricted.
 */
public class ConfiguredNamespacePolicy implements NamespacePolicy {
    private final boolean restricted;
    private final Set<String> allowed;

    public ConfiguredNamespacePolicy(CollectionsConfig config) {
        this.restricted = config.namespaceRestricted();
        this.allowed = config.allowedNamespaces();
    }

    @Override
    public boolean isAccessible(String pid) {
        if (!restricted) {
            return true;
        }
        return Pid.isValid(pid) && allowed.contains(Pid.parse(pid).namespace());
    }
}

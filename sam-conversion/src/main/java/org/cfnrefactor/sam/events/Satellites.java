package org.cfnrefactor.sam.events;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.Template;

/**
 * Removal guards for the rule and permission resources an event fold leaves behind.
 */
final class Satellites {

    private Satellites() {}

    /**
     * @return true when nothing but {@code ignored} references {@code logicalId}
     */
    static boolean isRemovable(Template template, String logicalId, Collection<String> ignored) {
        List<String> target = List.of(logicalId);
        return ResourceGraph.blockingReferences(template, target, ignored).isEmpty()
            && !ResourceGraph.isReferencedOutsideResources(template, target);
    }

    /**
     * Keep the ids that only reference each other or {@code ignored}.
     */
    static List<String> removable(Template template, Collection<String> logicalIds, Collection<String> ignored) {
        Set<String> skip = new HashSet<>(ignored);
        skip.addAll(logicalIds);
        List<String> removable = new ArrayList<>();
        for (String id : logicalIds) {
            if (isRemovable(template, id, skip)) {
                removable.add(id);
            }
        }
        return removable;
    }
}

package io.clusteroperator.components;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Components of one cluster in dependency order. Construction fails on duplicate names,
 * on dependencies outside the graph and on cycles.
 */
public class ComponentGraph {

    private final List<Component> ordered;
    private final Map<String, Component> byName;

    public ComponentGraph(List<Component> components) {
        this.byName = new LinkedHashMap<>();
        for (Component component : components) {
            if (byName.putIfAbsent(component.getName(), component) != null) {
                throw new IllegalArgumentException("Duplicate component name " + component.getName());
            }
        }
        this.ordered = Collections.unmodifiableList(sort(components));
    }

    private List<Component> sort(List<Component> components) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<Component>> dependents = new HashMap<>();
        for (Component component : components) {
            inDegree.putIfAbsent(component.getName(), 0);
            for (Component dependency : component.getDependencies()) {
                if (!byName.containsKey(dependency.getName())) {
                    throw new IllegalArgumentException(component.getName() + " depends on unknown component "
                            + dependency.getName());
                }
                inDegree.merge(component.getName(), 1, Integer::sum);
                dependents.computeIfAbsent(dependency.getName(), k -> new ArrayList<>()).add(component);
            }
        }

        // Kahn's algorithm; ties keep declaration order
        Deque<Component> ready = new ArrayDeque<>();
        for (Component component : components) {
            if (inDegree.get(component.getName()) == 0) {
                ready.add(component);
            }
        }
        List<Component> result = new ArrayList<>();
        while (!ready.isEmpty()) {
            Component next = ready.poll();
            result.add(next);
            for (Component dependent : dependents.getOrDefault(next.getName(), List.of())) {
                if (inDegree.merge(dependent.getName(), -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (result.size() != components.size()) {
            List<String> stuck = new ArrayList<>();
            for (Component component : components) {
                if (!result.contains(component)) {
                    stuck.add(component.getName());
                }
            }
            throw new IllegalStateException("Dependency cycle among components " + stuck);
        }
        return result;
    }

    public List<Component> getOrdered() {
        return ordered;
    }

    public Optional<Component> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return ordered.size();
    }
}

package io.clusteroperator.reconciler;

import io.clusteroperator.components.Component;
import io.clusteroperator.enums.SyncStatus;
import io.clusteroperator.models.ComponentStatus;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Folds component statuses into one cluster-wide status.
 * Ready iff every component is ready; otherwise the most specific cause is reported: the
 * first non-ready component in dependency order whose reason is not just another component.
 */
public final class StatusAggregator {

    @Value
    public static class Aggregate {
        SyncStatus syncStatus;
        String message;
    }

    private StatusAggregator() {
        // Utility class
    }

    /**
     * @param ordered         components in dependency order
     * @param statuses        statuses by component name
     * @param updateHeldBack  components needing an update that no wave will perform
     */
    public static Aggregate aggregate(List<Component> ordered, Map<String, ComponentStatus> statuses,
                                      List<String> updateHeldBack) {
        if (!updateHeldBack.isEmpty()) {
            return new Aggregate(SyncStatus.NEED_FULL_UPDATE,
                    "Full update required for " + String.join(", ", updateHeldBack));
        }

        Set<String> names = ordered.stream().map(Component::getName).collect(Collectors.toSet());
        ComponentStatus firstNotReady = null;
        String firstNotReadyName = null;
        for (Component component : ordered) {
            ComponentStatus status = statuses.get(component.getName());
            if (status == null || status.getSyncStatus() == SyncStatus.READY) {
                continue;
            }
            if (firstNotReady == null) {
                firstNotReady = status;
                firstNotReadyName = component.getName();
            }
            if (status.getReason() == null || !names.contains(status.getReason())) {
                return new Aggregate(status.getSyncStatus(), component.getName() + ": " + status);
            }
        }
        if (firstNotReady != null) {
            return new Aggregate(firstNotReady.getSyncStatus(), firstNotReadyName + ": " + firstNotReady);
        }
        return new Aggregate(SyncStatus.READY, "All components are ready");
    }
}

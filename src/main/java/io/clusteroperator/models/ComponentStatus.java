package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusteroperator.enums.SyncStatus;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Per-tick status of one component: a sync status plus an optional free-text reason.
 * A BLOCKED status whose reason is another component's name means "waiting on that component".
 */
@Getter
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ComponentStatus {

    @JsonProperty("sync_status")
    private final SyncStatus syncStatus;

    @JsonProperty("reason")
    private final String reason;

    @JsonCreator
    public ComponentStatus(@JsonProperty("sync_status") SyncStatus syncStatus,
                           @JsonProperty("reason") String reason) {
        this.syncStatus = Objects.requireNonNull(syncStatus, "syncStatus");
        this.reason = reason;
    }

    public static ComponentStatus simple(SyncStatus syncStatus) {
        return new ComponentStatus(syncStatus, null);
    }

    public static ComponentStatus ready() {
        return simple(SyncStatus.READY);
    }

    public static ComponentStatus pending(String reason) {
        return new ComponentStatus(SyncStatus.PENDING, reason);
    }

    public static ComponentStatus blocked(String reason) {
        return new ComponentStatus(SyncStatus.BLOCKED, reason);
    }

    public static ComponentStatus waiting(String reason) {
        return new ComponentStatus(SyncStatus.NEED_RESTART, reason);
    }

    public static ComponentStatus needLocalUpdate() {
        return simple(SyncStatus.NEED_LOCAL_UPDATE);
    }

    public boolean isRunning() {
        return syncStatus.isRunning();
    }

    @Override
    public String toString() {
        return reason == null ? syncStatus.name() : syncStatus.name() + "(" + reason + ")";
    }
}

package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusteroperator.enums.UpdateState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Bookkeeping of the running update wave: current phase and the components flagged when it began.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpdateStatus {

    @JsonProperty("state")
    @Builder.Default
    private UpdateState state = UpdateState.NONE;

    @JsonProperty("components")
    @Builder.Default
    private List<String> components = new ArrayList<>();

    @JsonProperty("conditions")
    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();

    public static UpdateStatus none() {
        return UpdateStatus.builder().build();
    }

    public boolean isFlagged(String componentName) {
        return components != null && components.contains(componentName);
    }
}

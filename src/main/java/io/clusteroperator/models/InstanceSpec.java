package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fabric8.kubernetes.api.model.Affinity;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.Toleration;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeMount;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of one role's instances: replica count, image override, resources, storage and placement.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceSpec {

    private String image;

    private int instanceCount = 1;

    private ResourceRequirements resources;

    private List<Volume> volumes = new ArrayList<>();

    private List<VolumeMount> volumeMounts = new ArrayList<>();

    private List<PersistentVolumeClaim> volumeClaimTemplates = new ArrayList<>();

    private List<LocationSpec> locations = new ArrayList<>();

    private Affinity affinity;

    private Map<String, String> nodeSelector = new HashMap<>();

    private List<Toleration> tolerations = new ArrayList<>();

    private List<LoggerSpec> loggers = new ArrayList<>();

    private Integer monitoringPort;
}

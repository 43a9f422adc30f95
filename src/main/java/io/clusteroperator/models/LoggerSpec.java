package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Logger configuration passed through to the generated server config.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoggerSpec {

    private String name;

    private String minLogLevel = "info";

    private String writerType = "file";

    private String compression = "none";

    private String format = "plain_text";

    private RotationPolicy rotationPolicy;

    private CategoriesFilter categoriesFilter;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RotationPolicy {
        private Long maxTotalSizeToKeep;
        private Long rotationPeriodMilliseconds;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CategoriesFilter {
        private String type;
        private List<String> values = new ArrayList<>();
    }
}

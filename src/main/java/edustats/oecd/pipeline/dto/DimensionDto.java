package edustats.oecd.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of {@code structure.dimensions.observation} in an SDMX-JSON
 * payload. Value positions are what observation keys index into.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DimensionDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("values")
    private List<Value> values = new ArrayList<>();

    public DimensionDto(String name, List<Value> values) {
        this.name = name;
        this.values = values;
    }

    /**
     * Convenience factory, mostly for building payloads in code.
     */
    public static DimensionDto of(String name, String... valueNames) {
        List<Value> values = new ArrayList<>();
        for (String valueName : valueNames) {
            values.add(new Value(null, valueName));
        }
        return new DimensionDto(name, values);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Value {

        @JsonProperty("id")
        private String id;

        @JsonProperty("name")
        private String name;
    }
}

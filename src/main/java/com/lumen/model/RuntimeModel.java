package com.lumen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Model installed on the runtime, as listed by {@code GET /api/tags}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuntimeModel {

    @JsonProperty("name")
    private String name;

    @JsonProperty("modified_at")
    private String modifiedAt;

    @JsonProperty("size")
    private Long size;

    @JsonProperty("digest")
    private String digest;

    @JsonProperty("details")
    private Details details;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Details {

        @JsonProperty("format")
        private String format;

        @JsonProperty("family")
        private String family;

        @JsonProperty("families")
        private List<String> families;

        @JsonProperty("parameter_size")
        private String parameterSize;

        @JsonProperty("quantization_level")
        private String quantizationLevel;
    }
}

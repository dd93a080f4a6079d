package com.stratus.config.template;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One property of a {@link ConfigurationSchema}, using the JSON-schema keywords the
 * engine understands.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaProperty {

    /** object | string | number | integer | boolean | array */
    private String type;

    private String description;

    @JsonProperty("default")
    private Object defaultValue;

    @JsonProperty("enum")
    private List<Object> enumValues;

    /** e.g. password, email, uri */
    private String format;

    private String pattern;

    private Double minimum;

    private Double maximum;

    /** Element schema for arrays */
    private SchemaProperty items;

    /** Nested properties for objects */
    private Map<String, SchemaProperty> properties;

    private List<String> required;
}

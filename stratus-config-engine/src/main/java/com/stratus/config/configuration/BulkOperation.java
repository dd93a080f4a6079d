package com.stratus.config.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A batch of configurations to create in one environment. Items only need key and value;
 * name defaults to the key and type to {@link ConfigurationType#STRING}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperation {

    private String environmentId;

    @Builder.Default
    private List<Configuration> configurations = new ArrayList<>();

    private String changeDescription;
}

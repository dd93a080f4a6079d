package com.stratus.config.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportRequest {

    private ExportFormat format;

    private String environmentId;

    /** When false, secret values are replaced by the redaction marker */
    private boolean includeSecrets;
}

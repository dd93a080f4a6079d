package com.stratus.config.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportRequest {

    private ExportFormat format;

    /** Raw document in {@link #format} */
    private String data;

    private String environmentId;

    /** Update keys that already exist instead of reporting them as conflicts */
    private boolean overwriteExisting;

    private String changeDescription;
}

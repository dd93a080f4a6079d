package com.stratus.config.secret;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecretRotationConfig {

    private boolean enabled;

    /** Arm a timer that rotates every {@link #interval} days */
    private boolean autoRotate;

    /** Rotation handler key, e.g. {@code password} or {@code api_key} */
    private String type;

    /** Days between automatic rotations */
    private int interval;

    /** Days of warning before a rotation is due */
    private int notifyBefore;

    /** Handler-specific settings such as {@code length} or {@code prefix} */
    @Builder.Default
    private Map<String, Object> settings = new HashMap<>();

    public SecretRotationConfig copy() {
        return toBuilder()
                .settings(settings != null ? new HashMap<>(settings) : new HashMap<>())
                .build();
    }
}

package com.stratus.config.configuration;

public record RollbackRequest(String configurationId, int targetVersion, String reason) {
}

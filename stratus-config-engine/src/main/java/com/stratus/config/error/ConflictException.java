package com.stratus.config.error;

public class ConflictException extends ConfigEngineException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    private ConflictException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * A writer observed a version that another writer has already replaced.
     */
    public static ConflictException concurrentModification(String entity, String id, int expectedVersion) {
        return new ConflictException(ErrorCode.CONCURRENT_MODIFICATION,
                entity + " " + id + " was modified concurrently (expected version " + expectedVersion + ")");
    }
}

package com.stratus.config.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One append-only audit entry. {@code entryHash} covers every other field plus
 * {@code previousHash}, chaining each entry to its predecessor.
 */
@Value
@Builder
public class SecretAuditLog {

    String id;

    /** Position in the global log, starting at 1 */
    long sequence;

    String secretId;

    AuditAction action;

    String principalId;

    PrincipalType principalType;

    boolean success;

    String errorMessage;

    Instant timestamp;

    String previousHash;

    String entryHash;
}

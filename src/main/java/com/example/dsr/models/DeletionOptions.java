package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-tunable erasure behaviour. Soft deletion, backups and human verification are on unless
 * the caller turns them off.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeletionOptions(
        @JsonProperty("cascade_delete") Boolean cascadeDelete,
        @JsonProperty("soft_delete") Boolean softDelete,
        @JsonProperty("backup_before_delete") Boolean backupBeforeDelete,
        @JsonProperty("verification_required") Boolean verificationRequired
) {

    public static final DeletionOptions DEFAULTS = new DeletionOptions(false, true, true, true);

    public DeletionOptions {
        cascadeDelete = cascadeDelete != null ? cascadeDelete : Boolean.FALSE;
        softDelete = softDelete != null ? softDelete : Boolean.TRUE;
        backupBeforeDelete = backupBeforeDelete != null ? backupBeforeDelete : Boolean.TRUE;
        verificationRequired = verificationRequired != null ? verificationRequired : Boolean.TRUE;
    }

    public String deletionType() {
        return Boolean.TRUE.equals(softDelete) ? "soft" : "hard";
    }
}

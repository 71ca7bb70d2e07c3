package io.tasklint.core.validation;

/**
 * Stages of one validation pass, in execution order. A pass that fails records the stage it failed
 * in; a pass that completes has gone through all of them.
 */
public enum ValidationStage {
    /** Object metadata, through {@link ObjectMetaValidator}. */
    METADATA,
    /** Required fields, names, mount paths and declaration types. */
    STRUCTURE,
    /** Placeholder references in step fields. */
    VARIABLES
}

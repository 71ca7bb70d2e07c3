package io.tasklint.core.validation;

import io.tasklint.core.error.FieldError;
import io.tasklint.core.error.TaskValidationException;
import io.tasklint.core.model.Step;
import io.tasklint.core.model.Task;
import io.tasklint.core.model.TaskSpec;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates task documents before they are accepted for execution.
 *
 * <p>
 * Order of checks: metadata, then the spec's structure (emptiness, steps,
 * volumes, workspaces, template-merged steps, exclusive declaration blocks,
 * resource and parameter types, step names), then placeholder references in
 * step fields. The first failure ends the pass; errors are never aggregated.
 *
 * <p>
 * Validation is a pure function of its input: it never mutates the task and
 * keeps no state between calls, so one instance may be shared across threads.
 * Callers must not modify a task while it is being validated.
 */
public final class TaskValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TaskValidator.class);

    private final ObjectMetaValidator metaValidator;
    private final StructuralChecker structuralChecker;
    private final StepVariableValidator variableValidator;

    /** Creates a validator that accepts any metadata. */
    public TaskValidator() {
        this(ObjectMetaValidator.ACCEPT_ALL);
    }

    /**
     * Creates a validator that delegates metadata rules to {@code metaValidator}.
     *
     * @param metaValidator metadata rules, applied before the spec is checked
     */
    public TaskValidator(ObjectMetaValidator metaValidator) {
        this.metaValidator = Objects.requireNonNull(metaValidator, "metaValidator must not be null");
        this.structuralChecker = new StructuralChecker();
        this.variableValidator = new StepVariableValidator();
    }

    /**
     * Validates a whole task: metadata (paths under {@code metadata}) and then its spec.
     *
     * @param task the task to validate
     * @return the verdict, never null
     */
    public ValidationResult validate(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        Optional<FieldError> metaError = metaValidator.validate(task.metadata());
        if (metaError.isPresent()) {
            return failed(task.metadata().name(), metaError.get().viaField("metadata"), ValidationStage.METADATA);
        }
        return validate(task.metadata().name(), task.spec());
    }

    /**
     * Validates a task spec on its own.
     *
     * @param spec the spec to validate
     * @return the verdict, never null
     */
    public ValidationResult validate(TaskSpec spec) {
        return validate(null, spec);
    }

    /**
     * Validates the task and throws if it is invalid.
     *
     * @param task the task to validate
     * @throws TaskValidationException carrying the first failure
     */
    public void requireValid(Task task) {
        ValidationResult result = validate(task);
        if (!result.isValid()) {
            throw new TaskValidationException(result.error(), task.metadata().name());
        }
    }

    private ValidationResult validate(String taskName, TaskSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        Optional<FieldError> structural = checkStructure(spec);
        if (structural.isPresent()) {
            return failed(taskName, structural.get(), ValidationStage.STRUCTURE);
        }

        Optional<FieldError> variables = checkVariables(spec);
        if (variables.isPresent()) {
            return failed(taskName, variables.get(), ValidationStage.VARIABLES);
        }

        LOG.debug("Task '{}' is valid ({} steps)", taskName, spec.steps().size());
        return ValidationResult.valid();
    }

    private Optional<FieldError> checkStructure(TaskSpec spec) {
        if (spec.isEmpty()) {
            return Optional.of(FieldError.missingField(FieldError.CURRENT_FIELD));
        }
        if (spec.steps().isEmpty()) {
            return Optional.of(FieldError.missingField("steps"));
        }
        List<Step> mergedSteps = StepTemplateMerger.merge(spec.stepTemplate(), spec.steps());
        return structuralChecker
                .checkVolumes(spec.volumes())
                .map(e -> e.viaField("volumes"))
                .or(() -> structuralChecker.checkWorkspaces(spec.workspaces(), spec.steps(), spec.stepTemplate()))
                .or(() -> structuralChecker.checkSteps(mergedSteps).map(e -> e.viaField("steps")))
                .or(() -> structuralChecker.checkExclusiveDeclarations(spec))
                .or(() -> structuralChecker.checkResources(spec.resources()))
                .or(() -> structuralChecker.checkParamTypes(spec.params()))
                .or(() -> structuralChecker.checkLegacyInputs(spec.inputs()))
                .or(() -> structuralChecker.checkLegacyOutputs(spec.outputs()))
                .or(() -> structuralChecker.checkStepNames(spec.steps()));
    }

    // Variable checks look at the steps as declared, not merged with the template.
    private Optional<FieldError> checkVariables(TaskSpec spec) {
        List<Step> steps = spec.steps();
        return variableValidator
                .validateParameterVariables(steps, spec.params())
                .or(() -> variableValidator.validateLegacyParameterVariables(steps, spec.inputs(), spec.params()))
                .or(() -> variableValidator.validateResourceVariables(steps, spec.resources()))
                .or(() -> variableValidator.validateLegacyResourceVariables(
                        steps, spec.inputs(), spec.outputs(), spec.resources()));
    }

    private static ValidationResult failed(String taskName, FieldError error, ValidationStage stage) {
        LOG.debug("Task '{}' rejected at {}: {} {}", taskName, stage, error.message(), error.paths());
        return ValidationResult.invalid(error, stage);
    }
}

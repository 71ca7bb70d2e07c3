package io.tasklint.core.validation;

import io.tasklint.core.error.FieldError;
import io.tasklint.core.model.Inputs;
import io.tasklint.core.model.Outputs;
import io.tasklint.core.model.ParamSpec;
import io.tasklint.core.model.Step;
import io.tasklint.core.model.TaskResources;
import io.tasklint.core.substitution.ReferenceScanner;
import io.tasklint.core.substitution.VariableChecks;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enforces placeholder usage rules over the string fields of every step.
 *
 * <p>
 * Two passes run per scope. The declared pass rejects references to names
 * outside the namespace, in any field. The array pass then applies the rule
 * for array-typed variables: in command and arg tokens the reference must be
 * the whole token; in every other field arrays may not be referenced at all.
 * Scalars are legal anywhere.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class StepVariableValidator {

    private static final VariableChecks PARAM_CHECKS = VariableChecks.forSteps(ReferenceScanner.PARAMS);
    private static final VariableChecks LEGACY_PARAM_CHECKS = VariableChecks.forSteps(ReferenceScanner.LEGACY_PARAMS);
    private static final VariableChecks RESOURCE_CHECKS = VariableChecks.forSteps(ReferenceScanner.RESOURCES);
    private static final VariableChecks LEGACY_RESOURCE_CHECKS =
            VariableChecks.forSteps(ReferenceScanner.LEGACY_RESOURCES);

    /** {@code $(params.x)} references against the parameters declared in {@code params}. */
    public Optional<FieldError> validateParameterVariables(List<Step> steps, List<ParamSpec> params) {
        VariableNamespace namespace = VariableNamespace.forParams(params);
        return validateVariables(steps, PARAM_CHECKS, namespace.names())
                .or(() -> validateArrayUsage(steps, PARAM_CHECKS, namespace.arrayNames()));
    }

    /**
     * {@code $(inputs.params.x)} references against the parameters of both {@code params} and the
     * deprecated {@code inputs.params}.
     */
    public Optional<FieldError> validateLegacyParameterVariables(
            List<Step> steps, Inputs inputs, List<ParamSpec> params) {
        VariableNamespace namespace = VariableNamespace.forParams(params, inputs);
        return validateVariables(steps, LEGACY_PARAM_CHECKS, namespace.names())
                .or(() -> validateArrayUsage(steps, LEGACY_PARAM_CHECKS, namespace.arrayNames()));
    }

    /** {@code $(resources.inputs.x)} references; skipped when no {@code resources} block exists. */
    public Optional<FieldError> validateResourceVariables(List<Step> steps, TaskResources resources) {
        if (resources == null) {
            return Optional.empty();
        }
        return validateVariables(steps, RESOURCE_CHECKS, VariableNamespace.forResources(resources).names());
    }

    /** {@code $(inputs.resources.x)} references against every declared resource. */
    public Optional<FieldError> validateLegacyResourceVariables(
            List<Step> steps, Inputs inputs, Outputs outputs, TaskResources resources) {
        VariableNamespace namespace = VariableNamespace.forResources(resources, inputs, outputs);
        return validateVariables(steps, LEGACY_RESOURCE_CHECKS, namespace.names());
    }

    /** Rejects the first reference to a name not in {@code declared}, scanning every step field. */
    public Optional<FieldError> validateVariables(List<Step> steps, VariableChecks checks, Set<String> declared) {
        for (Step step : steps) {
            for (StepField field : StepField.of(step)) {
                Optional<FieldError> err = checks.findUndeclared(field.name(), field.value(), declared);
                if (err.isPresent()) {
                    return err;
                }
            }
        }
        return Optional.empty();
    }

    /** Rejects the first array reference that is not a whole command/arg token. */
    public Optional<FieldError> validateArrayUsage(List<Step> steps, VariableChecks checks, Set<String> arrayNames) {
        if (arrayNames.isEmpty()) {
            return Optional.empty();
        }
        for (Step step : steps) {
            for (StepField field : StepField.of(step)) {
                Optional<FieldError> err = field.wholeTokenField()
                        ? checks.findNonIsolatedArrayUse(field.name(), field.value(), arrayNames)
                        : checks.findProhibitedArrayUse(field.name(), field.value(), arrayNames);
                if (err.isPresent()) {
                    return err;
                }
            }
        }
        return Optional.empty();
    }
}

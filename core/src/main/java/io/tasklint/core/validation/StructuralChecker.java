package io.tasklint.core.validation;

import static io.tasklint.core.error.FieldError.quote;

import io.tasklint.core.error.ErrorKind;
import io.tasklint.core.error.FieldError;
import io.tasklint.core.model.Inputs;
import io.tasklint.core.model.Outputs;
import io.tasklint.core.model.ParamSpec;
import io.tasklint.core.model.ParamType;
import io.tasklint.core.model.ResourceType;
import io.tasklint.core.model.Step;
import io.tasklint.core.model.StepTemplate;
import io.tasklint.core.model.TaskResource;
import io.tasklint.core.model.TaskResources;
import io.tasklint.core.model.TaskSpec;
import io.tasklint.core.model.Volume;
import io.tasklint.core.model.VolumeMount;
import io.tasklint.core.model.WorkspaceDeclaration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Name, mount path and declaration-type checks that do not look inside string values.
 *
 * <p>
 * Each check returns the first problem it finds. Sets used to detect
 * duplicates are local to one call.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class StructuralChecker {

    /** Steps may not mount volumes under this prefix... */
    static final String RESERVED_MOUNT_PREFIX = "/tekton/";

    /** ...except under this one, which is the steps' home directory. */
    static final String ALLOWED_RESERVED_MOUNT_PREFIX = "/tekton/home";

    /** Volume names with this prefix belong to the runtime. */
    static final String RESERVED_VOLUME_NAME_PREFIX = "tekton-internal-";

    /** Volume names must be pairwise distinct. Paths are relative to {@code volumes}. */
    public Optional<FieldError> checkVolumes(List<Volume> volumes) {
        Set<String> seen = new HashSet<>();
        for (Volume v : volumes) {
            if (!seen.add(v.name())) {
                return Optional.of(FieldError.of(
                        ErrorKind.DUPLICATE_NAME, "multiple volumes with same name " + quote(v.name()), "name"));
            }
        }
        return Optional.empty();
    }

    /**
     * Workspace names must be unique, and no workspace may mount where a step, the step template or
     * an earlier workspace already mounts. Step and template mounts are collected first; workspaces
     * are then added one at a time in declaration order.
     */
    public Optional<FieldError> checkWorkspaces(
            List<WorkspaceDeclaration> workspaces, List<Step> steps, StepTemplate stepTemplate) {
        Set<String> mountPaths = new HashSet<>();
        for (Step step : steps) {
            for (VolumeMount vm : step.volumeMounts()) {
                mountPaths.add(MountPaths.clean(vm.mountPath()));
            }
        }
        if (stepTemplate != null) {
            for (VolumeMount vm : stepTemplate.volumeMounts()) {
                mountPaths.add(MountPaths.clean(vm.mountPath()));
            }
        }

        Set<String> names = new HashSet<>();
        for (WorkspaceDeclaration w : workspaces) {
            if (!names.add(w.name())) {
                return Optional.of(FieldError.of(
                        ErrorKind.DUPLICATE_NAME,
                        "workspace name " + quote(w.name()) + " must be unique",
                        "workspaces.name"));
            }
            String mountPath = MountPaths.clean(w.resolvedMountPath());
            if (!mountPaths.add(mountPath)) {
                return Optional.of(FieldError.of(
                        ErrorKind.PATH_CONFLICT,
                        "workspace mount path " + quote(mountPath) + " must be unique",
                        "workspaces.mountpath"));
            }
        }
        return Optional.empty();
    }

    /**
     * Per-step rules on template-merged steps: image required, script excludes command, unique
     * non-empty names, no mounts under the reserved prefix, no reserved volume names. Paths are
     * relative to {@code steps}.
     */
    public Optional<FieldError> checkSteps(List<Step> steps) {
        Set<String> names = new HashSet<>();
        for (int idx = 0; idx < steps.size(); idx++) {
            Step s = steps.get(idx);
            if (s.image().isEmpty()) {
                return Optional.of(FieldError.missingField("Image"));
            }
            if (!s.script().isEmpty() && !s.command().isEmpty()) {
                return Optional.of(FieldError.of(
                        ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET,
                        "step " + idx + " script cannot be used with command",
                        "script"));
            }
            if (!s.name().isEmpty() && !names.add(s.name())) {
                return Optional.of(FieldError.invalidValue(ErrorKind.DUPLICATE_NAME, s.name(), "name"));
            }
            for (VolumeMount vm : s.volumeMounts()) {
                if (vm.mountPath().startsWith(RESERVED_MOUNT_PREFIX)
                        && !vm.mountPath().startsWith(ALLOWED_RESERVED_MOUNT_PREFIX)) {
                    return Optional.of(FieldError.of(
                            ErrorKind.INVALID_VALUE,
                            "step " + idx + " volumeMount cannot be mounted under " + RESERVED_MOUNT_PREFIX
                                    + " (volumeMount " + quote(vm.name()) + " mounted at " + quote(vm.mountPath())
                                    + ")",
                            "volumeMounts.mountPath"));
                }
                if (vm.name().startsWith(RESERVED_VOLUME_NAME_PREFIX)) {
                    return Optional.of(FieldError.of(
                            ErrorKind.INVALID_VALUE,
                            "step " + idx + " volumeMount name " + quote(vm.name()) + " cannot start with "
                                    + quote(RESERVED_VOLUME_NAME_PREFIX),
                            "volumeMounts.name"));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * A deprecated block and its replacement may not both be populated: {@code inputs.params} vs
     * {@code params}, {@code inputs.resources} vs {@code resources.inputs}, {@code
     * outputs.resources} vs {@code resources.outputs}.
     */
    public Optional<FieldError> checkExclusiveDeclarations(TaskSpec spec) {
        Inputs inputs = spec.inputs();
        TaskResources resources = spec.resources();
        if (inputs != null) {
            if (!inputs.params().isEmpty() && !spec.params().isEmpty()) {
                return Optional.of(
                        FieldError.multipleOneOf(ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET, "inputs.params", "params"));
            }
            if (resources != null
                    && !resources.inputs().isEmpty()
                    && !inputs.resources().isEmpty()) {
                return Optional.of(FieldError.multipleOneOf(
                        ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET, "inputs.resources", "resources.inputs"));
            }
        }
        Outputs outputs = spec.outputs();
        if (outputs != null
                && resources != null
                && !resources.outputs().isEmpty()
                && !outputs.resources().isEmpty()) {
            return Optional.of(FieldError.multipleOneOf(
                    ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET, "outputs.resources", "resources.outputs"));
        }
        return Optional.empty();
    }

    /** Types and name uniqueness of {@code resources.inputs} and {@code resources.outputs}. */
    public Optional<FieldError> checkResources(TaskResources resources) {
        if (resources == null) {
            return Optional.empty();
        }
        return checkResourceDirection(resources.inputs(), "inputs")
                .or(() -> checkResourceDirection(resources.outputs(), "outputs"));
    }

    /** Types and defaults of {@code params}. */
    public Optional<FieldError> checkParamTypes(List<ParamSpec> params) {
        for (ParamSpec p : params) {
            Optional<FieldError> err = checkParamType(p, "taskspec.params." + p.name());
            if (err.isPresent()) {
                return err;
            }
        }
        return Optional.empty();
    }

    /** Resource types, resource name uniqueness and parameter types of the deprecated {@code inputs}. */
    public Optional<FieldError> checkLegacyInputs(Inputs inputs) {
        if (inputs == null) {
            return Optional.empty();
        }
        for (TaskResource r : inputs.resources()) {
            Optional<FieldError> err = checkResourceType(r, "taskspec.Inputs.Resources." + r.name() + ".Type");
            if (err.isPresent()) {
                return err;
            }
        }
        Optional<FieldError> dup = checkForDuplicates(inputs.resources(), "taskspec.Inputs.Resources.Name");
        if (dup.isPresent()) {
            return dup;
        }
        for (ParamSpec p : inputs.params()) {
            Optional<FieldError> err = checkParamType(p, "taskspec.inputs.params." + p.name());
            if (err.isPresent()) {
                return err;
            }
        }
        return Optional.empty();
    }

    /** Resource types and name uniqueness of the deprecated {@code outputs}. */
    public Optional<FieldError> checkLegacyOutputs(Outputs outputs) {
        if (outputs == null) {
            return Optional.empty();
        }
        for (TaskResource r : outputs.resources()) {
            Optional<FieldError> err = checkResourceType(r, "taskspec.Outputs.Resources." + r.name() + ".Type");
            if (err.isPresent()) {
                return err;
            }
        }
        return checkForDuplicates(outputs.resources(), "taskspec.Outputs.Resources.Name");
    }

    /** Non-empty step names must be DNS-1123 labels. */
    public Optional<FieldError> checkStepNames(List<Step> steps) {
        for (Step step : steps) {
            if (!step.name().isEmpty() && !DnsLabel.isValid(step.name())) {
                return Optional.of(FieldError.of(
                                ErrorKind.INVALID_NAME_SYNTAX,
                                "invalid value " + quote(step.name()),
                                "taskspec.steps.name")
                        .withDetails(DnsLabel.STEP_NAME_DETAILS));
            }
        }
        return Optional.empty();
    }

    private Optional<FieldError> checkResourceDirection(List<TaskResource> resources, String direction) {
        for (TaskResource r : resources) {
            Optional<FieldError> err =
                    checkResourceType(r, "taskspec.resources." + direction + "." + r.name() + ".type");
            if (err.isPresent()) {
                return err;
            }
        }
        return checkForDuplicates(resources, "taskspec.resources." + direction + ".name");
    }

    private Optional<FieldError> checkResourceType(TaskResource resource, String path) {
        if (ResourceType.fromWireName(resource.type()).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(FieldError.invalidValue(ErrorKind.INVALID_ENUM_VALUE, resource.type(), path));
    }

    /** Resource names compare ignoring case. */
    private Optional<FieldError> checkForDuplicates(List<TaskResource> resources, String path) {
        Set<String> seen = new HashSet<>();
        for (TaskResource r : resources) {
            if (!seen.add(r.name().toLowerCase(Locale.ROOT))) {
                return Optional.of(FieldError.multipleOneOf(ErrorKind.DUPLICATE_NAME, path));
            }
        }
        return Optional.empty();
    }

    private Optional<FieldError> checkParamType(ParamSpec p, String pathPrefix) {
        if (ParamType.fromWireName(p.type()).isEmpty()) {
            return Optional.of(FieldError.invalidValue(ErrorKind.INVALID_ENUM_VALUE, p.type(), pathPrefix + ".type"));
        }
        if (p.defaultValue() != null && !p.defaultValue().type().equals(p.type())) {
            return Optional.of(FieldError.of(
                    ErrorKind.TYPE_MISMATCH,
                    quote(p.type()) + " type does not match default value's type: " + quote(p.defaultValue().type()),
                    pathPrefix + ".type",
                    pathPrefix + ".default.type"));
        }
        return Optional.empty();
    }
}

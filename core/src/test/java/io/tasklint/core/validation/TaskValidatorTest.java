package io.tasklint.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.tasklint.core.error.ErrorKind;
import io.tasklint.core.error.FieldError;
import io.tasklint.core.error.TaskValidationException;
import io.tasklint.core.model.Inputs;
import io.tasklint.core.model.ObjectMeta;
import io.tasklint.core.model.ParamSpec;
import io.tasklint.core.model.Step;
import io.tasklint.core.model.StepTemplate;
import io.tasklint.core.model.Task;
import io.tasklint.core.model.TaskSpec;
import io.tasklint.core.model.Volume;
import io.tasklint.core.model.VolumeMount;
import io.tasklint.core.model.WorkspaceDeclaration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("TaskValidator")
class TaskValidatorTest {

    private final TaskValidator validator = new TaskValidator();

    private static Step.Builder busybox(String name) {
        return Step.builder().name(name).image("busybox");
    }

    private static TaskSpec.Builder oneStep() {
        return TaskSpec.builder().addStep(busybox("build").build());
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        @DisplayName("empty spec is reported against the spec itself")
        void emptySpec() {
            ValidationResult result = validator.validate(TaskSpec.builder().build());

            assertThat(result.isValid()).isFalse();
            assertThat(result.failedStage()).isEqualTo(ValidationStage.STRUCTURE);
            assertThat(result.error().message()).isEqualTo("missing field(s)");
            assertThat(result.error().paths()).containsExactly(FieldError.CURRENT_FIELD);
        }

        @Test
        @DisplayName("zero steps is a missing steps field")
        void noSteps() {
            ValidationResult result =
                    validator.validate(TaskSpec.builder().addParam(ParamSpec.string("p")).build());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.MISSING_REQUIRED_FIELD);
            assertThat(result.error().paths()).containsExactly("steps");
        }

        @Test
        @DisplayName("duplicate step names are an invalid value under steps")
        void duplicateStepNames() {
            TaskSpec spec = TaskSpec.builder()
                    .addStep(busybox("foo").build())
                    .addStep(busybox("foo").build())
                    .build();

            FieldError error = validator.validate(spec).error();

            assertThat(error.message()).isEqualTo("invalid value: foo");
            assertThat(error.paths()).containsExactly("steps.name");
        }

        @Test
        @DisplayName("script with command is mutually exclusive")
        void scriptAndCommand() {
            TaskSpec spec = TaskSpec.builder()
                    .addStep(busybox("s").command("sh").script("echo hi").build())
                    .build();

            FieldError error = validator.validate(spec).error();

            assertThat(error.kind()).isEqualTo(ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET);
            assertThat(error.paths()).containsExactly("steps.script");
        }

        @Test
        @DisplayName("command inherited from the template also conflicts with script")
        void templateCommandAndScript() {
            StepTemplate template = new StepTemplate("", List.of("sh"), List.of(), "", List.of(), List.of());
            TaskSpec spec = TaskSpec.builder()
                    .stepTemplate(template)
                    .addStep(busybox("s").script("echo hi").build())
                    .build();

            assertThat(validator.validate(spec).error().paths()).containsExactly("steps.script");
        }

        @Test
        @DisplayName("image may come from the step template")
        void imageFromTemplate() {
            StepTemplate template = new StepTemplate("alpine", List.of(), List.of(), "", List.of(), List.of());
            TaskSpec spec = TaskSpec.builder()
                    .stepTemplate(template)
                    .addStep(Step.builder().name("s").command("true").build())
                    .build();

            assertThat(validator.validate(spec).isValid()).isTrue();
        }

        @Test
        @DisplayName("declared but empty steps list is a missing steps field")
        void declaredEmptySteps() {
            TaskSpec spec = TaskSpec.builder().steps(List.of()).build();

            assertThat(spec.isEmpty()).isFalse();
            assertThat(validator.validate(spec).error().paths()).containsExactly("steps");
        }

        @Test
        @DisplayName("template mount under the reserved prefix is rejected on every step")
        void templateReservedMountPath() {
            StepTemplate template = new StepTemplate(
                    "", List.of(), List.of(), "", List.of(), List.of(VolumeMount.of("results", "/tekton/results")));
            TaskSpec spec = TaskSpec.builder()
                    .stepTemplate(template)
                    .addStep(busybox("s").build())
                    .build();

            ValidationResult result = validator.validate(spec);

            assertThat(result.error().kind()).isEqualTo(ErrorKind.INVALID_VALUE);
            assertThat(result.error().paths()).containsExactly("steps.volumeMounts.mountPath");
        }

        @Test
        @DisplayName("template mount with a reserved volume name is rejected")
        void templateReservedMountName() {
            StepTemplate template = new StepTemplate(
                    "", List.of(), List.of(), "", List.of(), List.of(VolumeMount.of("tekton-internal-x", "/data")));
            TaskSpec spec = TaskSpec.builder()
                    .stepTemplate(template)
                    .addStep(busybox("s").build())
                    .build();

            assertThat(validator.validate(spec).error().paths()).containsExactly("steps.volumeMounts.name");
        }

        @Test
        @DisplayName("missing image is reported under steps")
        void missingImage() {
            TaskSpec spec = TaskSpec.builder().addStep(Step.builder().name("s").build()).build();

            assertThat(validator.validate(spec).error().paths()).containsExactly("steps.Image");
        }

        @Test
        @DisplayName("duplicate volumes are reported under volumes")
        void duplicateVolumes() {
            TaskSpec spec = oneStep().addVolume(new Volume("v")).addVolume(new Volume("v")).build();

            assertThat(validator.validate(spec).error().paths()).containsExactly("volumes.name");
        }

        @Test
        @DisplayName("equal cleaned workspace paths conflict regardless of order")
        void workspacePathConflict() {
            WorkspaceDeclaration a = WorkspaceDeclaration.of("a", "/data");
            WorkspaceDeclaration b = WorkspaceDeclaration.of("b", "/data/");

            ValidationResult ab = validator.validate(oneStep().addWorkspace(a).addWorkspace(b).build());
            ValidationResult ba = validator.validate(oneStep().addWorkspace(b).addWorkspace(a).build());

            assertThat(ab.error().kind()).isEqualTo(ErrorKind.PATH_CONFLICT);
            assertThat(ab.error().paths()).containsExactly("workspaces.mountpath");
            assertThat(ba.error().kind()).isEqualTo(ErrorKind.PATH_CONFLICT);
        }

        @Test
        @DisplayName("volumes are checked before workspaces")
        void volumesBeforeWorkspaces() {
            TaskSpec spec = oneStep()
                    .addVolume(new Volume("v"))
                    .addVolume(new Volume("v"))
                    .addWorkspace(WorkspaceDeclaration.of("w"))
                    .addWorkspace(WorkspaceDeclaration.of("w"))
                    .build();

            assertThat(validator.validate(spec).error().paths()).containsExactly("volumes.name");
        }

        @Test
        @DisplayName("legacy and new parameter blocks may not both be populated")
        void exclusiveParams() {
            TaskSpec spec = oneStep()
                    .addParam(ParamSpec.string("p"))
                    .inputs(new Inputs(List.of(), List.of(ParamSpec.string("q"))))
                    .build();

            assertThat(validator.validate(spec).error().paths()).containsExactly("inputs.params", "params");
        }

        @Test
        @DisplayName("invalid step name is reported after the other structural checks")
        void stepNameSyntax() {
            TaskSpec spec = TaskSpec.builder().addStep(busybox("Not_A_Label").build()).build();

            FieldError error = validator.validate(spec).error();

            assertThat(error.kind()).isEqualTo(ErrorKind.INVALID_NAME_SYNTAX);
            assertThat(error.paths()).containsExactly("taskspec.steps.name");
        }

        @Test
        @DisplayName("structural errors win over variable errors")
        void structureBeforeVariables() {
            TaskSpec spec = TaskSpec.builder()
                    .addStep(busybox("dup").args("$(params.nope)").build())
                    .addStep(busybox("dup").build())
                    .build();

            ValidationResult result = validator.validate(spec);

            assertThat(result.failedStage()).isEqualTo(ValidationStage.STRUCTURE);
        }
    }

    @Nested
    @DisplayName("variables")
    class Variables {

        @Test
        @DisplayName("scalar embedded in env is legal")
        void scalarInEnv() {
            TaskSpec spec = TaskSpec.builder()
                    .addParam(ParamSpec.string("name"))
                    .addStep(busybox("s").addEnv("GREETING", "hello $(params.name)!").build())
                    .build();

            assertThat(validator.validate(spec).isValid()).isTrue();
        }

        @Test
        @DisplayName("array as a whole command token passes")
        void arrayAsWholeToken() {
            TaskSpec spec = TaskSpec.builder()
                    .addParam(ParamSpec.array("arr"))
                    .addStep(busybox("s").command("echo", "$(params.arr)").build())
                    .build();

            assertThat(validator.validate(spec)).isEqualTo(ValidationResult.valid());
        }

        @Test
        @DisplayName("array embedded in a command token fails")
        void arrayEmbeddedInToken() {
            TaskSpec spec = TaskSpec.builder()
                    .addParam(ParamSpec.array("arr"))
                    .addStep(busybox("s").command("echo-$(params.arr)").build())
                    .build();

            ValidationResult result = validator.validate(spec);

            assertThat(result.failedStage()).isEqualTo(ValidationStage.VARIABLES);
            assertThat(result.error().kind()).isEqualTo(ErrorKind.ILLEGAL_ARRAY_SPLICE);
            assertThat(result.error().paths()).containsExactly("taskspec.steps.command[0]");
        }

        @Test
        @DisplayName("undeclared reference fails with the field path")
        void undeclaredReference() {
            TaskSpec spec = TaskSpec.builder()
                    .addStep(busybox("s").args("$(params.missing)").build())
                    .build();

            FieldError error = validator.validate(spec).error();

            assertThat(error.kind()).isEqualTo(ErrorKind.UNRESOLVED_VARIABLE_REFERENCE);
            assertThat(error.paths()).containsExactly("taskspec.steps.arg[0]");
        }

        @Test
        @DisplayName("template fields are not scanned for references")
        void templateNotScanned() {
            StepTemplate template = new StepTemplate(
                    "alpine", List.of(), List.of("$(params.undeclared)"), "", List.of(), List.of());
            TaskSpec spec = TaskSpec.builder()
                    .stepTemplate(template)
                    .addStep(Step.builder().name("s").build())
                    .build();

            assertThat(validator.validate(spec).isValid()).isTrue();
        }

        @Test
        @DisplayName("resource references resolve against declared resources")
        void legacyResources() {
            TaskSpec spec = TaskSpec.builder()
                    .addStep(busybox("s")
                            .addVolumeMount(VolumeMount.of("src", "/src"))
                            .workingDir("$(inputs.resources.missing.path)")
                            .build())
                    .build();

            assertThat(validator.validate(spec).error().paths()).containsExactly("taskspec.steps.workingDir");
        }
    }

    @Test
    @DisplayName("validation is idempotent")
    void idempotent() {
        TaskSpec spec = TaskSpec.builder()
                .addParam(ParamSpec.array("arr"))
                .addStep(busybox("s").args("x$(params.arr)").build())
                .build();

        ValidationResult first = validator.validate(spec);
        ValidationResult second = validator.validate(spec);

        assertThat(second).isEqualTo(first);
        assertThat(validator.validate(oneStep().build())).isEqualTo(validator.validate(oneStep().build()));
    }

    @Nested
    @DisplayName("whole tasks")
    @ExtendWith(MockitoExtension.class)
    class WholeTasks {

        @Mock
        ObjectMetaValidator metaValidator;

        @Test
        @DisplayName("metadata errors are nested under metadata and stop the pass")
        void metadataError() {
            when(metaValidator.validate(any()))
                    .thenReturn(Optional.of(FieldError.invalidValue(ErrorKind.INVALID_VALUE, "BAD", "name")));
            Task task = new Task(new ObjectMeta("BAD", null), TaskSpec.builder().build());

            ValidationResult result = new TaskValidator(metaValidator).validate(task);

            assertThat(result.failedStage()).isEqualTo(ValidationStage.METADATA);
            assertThat(result.error().paths()).containsExactly("metadata.name");
            verify(metaValidator).validate(task.metadata());
        }

        @Test
        @DisplayName("valid metadata continues to the spec")
        void metadataAccepted() {
            when(metaValidator.validate(any())).thenReturn(Optional.empty());
            Task task = new Task(new ObjectMeta("build", "ci"), oneStep().build());

            assertThat(new TaskValidator(metaValidator).validate(task).isValid()).isTrue();
        }

        @Test
        @DisplayName("validating a spec alone skips metadata")
        void specOnly() {
            new TaskValidator(metaValidator).validate(oneStep().build());

            verify(metaValidator, never()).validate(any());
        }

        @Test
        @DisplayName("requireValid throws with the field error and task name")
        void requireValidThrows() {
            Task task = new Task(new ObjectMeta("broken", null), TaskSpec.builder().build());

            assertThatThrownBy(() -> validator.requireValid(task))
                    .isInstanceOf(TaskValidationException.class)
                    .satisfies(e -> {
                        TaskValidationException ex = (TaskValidationException) e;
                        assertThat(ex.taskName()).isEqualTo("broken");
                        assertThat(ex.fieldError().kind()).isEqualTo(ErrorKind.MISSING_REQUIRED_FIELD);
                        assertThat(ex.getMessage()).isEqualTo("missing field(s): ");
                    });
        }

        @Test
        @DisplayName("requireValid returns quietly for a valid task")
        void requireValidPasses() {
            validator.requireValid(new Task(ObjectMeta.empty(), oneStep().build()));
        }
    }
}

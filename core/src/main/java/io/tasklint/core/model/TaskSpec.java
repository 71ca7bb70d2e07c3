package io.tasklint.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The specification of a task: steps, declarations and the deprecated {@code inputs}/{@code
 * outputs} blocks.
 *
 * <p>
 * Immutable, thread-safe. {@code stepTemplate}, {@code resources}, {@code inputs}
 * and {@code outputs} are null when the document does not declare them; every
 * list is non-null. {@code listDeclared} tells a declared empty list (such as
 * {@code steps: []}) apart from an absent one; it is forced to {@code true} when
 * any list has elements.
 */
public record TaskSpec(
        List<Step> steps,
        StepTemplate stepTemplate,
        List<Volume> volumes,
        List<WorkspaceDeclaration> workspaces,
        List<ParamSpec> params,
        TaskResources resources,
        Inputs inputs,
        Outputs outputs,
        boolean listDeclared) {

    public TaskSpec {
        steps = steps != null ? List.copyOf(steps) : List.of();
        volumes = volumes != null ? List.copyOf(volumes) : List.of();
        workspaces = workspaces != null ? List.copyOf(workspaces) : List.of();
        params = params != null ? List.copyOf(params) : List.of();
        listDeclared = listDeclared
                || !steps.isEmpty()
                || !volumes.isEmpty()
                || !workspaces.isEmpty()
                || !params.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns {@code true} if nothing at all is declared, not even an empty list. */
    public boolean isEmpty() {
        return !listDeclared
                && stepTemplate == null
                && resources == null
                && inputs == null
                && outputs == null;
    }

    /** Builder for {@link TaskSpec}. */
    public static final class Builder {
        private final List<Step> steps = new ArrayList<>();
        private StepTemplate stepTemplate;
        private final List<Volume> volumes = new ArrayList<>();
        private final List<WorkspaceDeclaration> workspaces = new ArrayList<>();
        private final List<ParamSpec> params = new ArrayList<>();
        private TaskResources resources;
        private Inputs inputs;
        private Outputs outputs;
        private boolean listDeclared;

        Builder() {}

        public Builder addStep(Step step) {
            steps.add(step);
            return this;
        }

        /** Replaces the steps; an empty list still counts as declared. */
        public Builder steps(List<Step> steps) {
            this.steps.clear();
            this.steps.addAll(steps);
            listDeclared = true;
            return this;
        }

        public Builder stepTemplate(StepTemplate stepTemplate) {
            this.stepTemplate = stepTemplate;
            return this;
        }

        public Builder addVolume(Volume volume) {
            volumes.add(volume);
            return this;
        }

        public Builder volumes(List<Volume> volumes) {
            this.volumes.clear();
            this.volumes.addAll(volumes);
            listDeclared = true;
            return this;
        }

        public Builder addWorkspace(WorkspaceDeclaration workspace) {
            workspaces.add(workspace);
            return this;
        }

        public Builder workspaces(List<WorkspaceDeclaration> workspaces) {
            this.workspaces.clear();
            this.workspaces.addAll(workspaces);
            listDeclared = true;
            return this;
        }

        public Builder addParam(ParamSpec param) {
            params.add(param);
            return this;
        }

        public Builder params(List<ParamSpec> params) {
            this.params.clear();
            this.params.addAll(params);
            listDeclared = true;
            return this;
        }

        public Builder resources(TaskResources resources) {
            this.resources = resources;
            return this;
        }

        public Builder inputs(Inputs inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(Outputs outputs) {
            this.outputs = outputs;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(
                    steps, stepTemplate, volumes, workspaces, params, resources, inputs, outputs, listDeclared);
        }
    }
}

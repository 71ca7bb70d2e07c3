package io.tasklint.core.validation;

import io.tasklint.core.model.Inputs;
import io.tasklint.core.model.Outputs;
import io.tasklint.core.model.ParamSpec;
import io.tasklint.core.model.TaskResource;
import io.tasklint.core.model.TaskResources;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declared variable names of one scope, with the array-typed subset.
 *
 * <p>
 * Built fresh for each validation pass. Merging is a plain union: a name
 * declared in both the current and the deprecated block is one variable.
 * Duplicate detection is the structural checker's job.
 *
 * @param names      every declared name
 * @param arrayNames the names declared with type {@code array}; always a subset of {@code names}
 */
public record VariableNamespace(Set<String> names, Set<String> arrayNames) {

    public VariableNamespace {
        names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
        arrayNames = Collections.unmodifiableSet(new LinkedHashSet<>(arrayNames));
    }

    /** Parameters declared in {@code params}. */
    public static VariableNamespace forParams(List<ParamSpec> params) {
        return forParams(params, null);
    }

    /** Parameters declared in {@code params} and in the deprecated {@code inputs.params}. */
    public static VariableNamespace forParams(List<ParamSpec> params, Inputs legacyInputs) {
        Set<String> names = new LinkedHashSet<>();
        Set<String> arrayNames = new LinkedHashSet<>();
        addParams(params, names, arrayNames);
        if (legacyInputs != null) {
            addParams(legacyInputs.params(), names, arrayNames);
        }
        return new VariableNamespace(names, arrayNames);
    }

    /** Resources declared in {@code resources.inputs} and {@code resources.outputs}. */
    public static VariableNamespace forResources(TaskResources resources) {
        return forResources(resources, null, null);
    }

    /** Resources declared in {@code resources} and in the deprecated input/output blocks. */
    public static VariableNamespace forResources(TaskResources resources, Inputs legacyInputs, Outputs legacyOutputs) {
        Set<String> names = new LinkedHashSet<>();
        if (resources != null) {
            addResources(resources.inputs(), names);
            addResources(resources.outputs(), names);
        }
        if (legacyInputs != null) {
            addResources(legacyInputs.resources(), names);
        }
        if (legacyOutputs != null) {
            addResources(legacyOutputs.resources(), names);
        }
        return new VariableNamespace(names, Set.of());
    }

    private static void addParams(Collection<ParamSpec> params, Set<String> names, Set<String> arrayNames) {
        for (ParamSpec p : params) {
            names.add(p.name());
            if (p.isArray()) {
                arrayNames.add(p.name());
            }
        }
    }

    private static void addResources(Collection<TaskResource> resources, Set<String> names) {
        for (TaskResource r : resources) {
            names.add(r.name());
        }
    }
}

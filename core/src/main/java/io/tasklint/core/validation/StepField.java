package io.tasklint.core.validation;

import io.tasklint.core.model.EnvVar;
import io.tasklint.core.model.Step;
import io.tasklint.core.model.VolumeMount;
import java.util.ArrayList;
import java.util.List;

/**
 * A string-valued step field that may hold placeholders.
 *
 * @param name          field name relative to the step, e.g. {@code command[1]} or {@code env[HOME]}
 * @param value         the field value
 * @param wholeTokenField {@code true} for command and arg tokens, where an array reference may
 *                      appear as the whole token
 */
record StepField(String name, String value, boolean wholeTokenField) {

    /**
     * Lists the scanned fields of a step in check order: name, image, workingDir, command tokens,
     * arg tokens, env values, then name/mountPath/subPath of each volume mount.
     */
    static List<StepField> of(Step step) {
        List<StepField> fields = new ArrayList<>();
        fields.add(new StepField("name", step.name(), false));
        fields.add(new StepField("image", step.image(), false));
        fields.add(new StepField("workingDir", step.workingDir(), false));
        for (int i = 0; i < step.command().size(); i++) {
            fields.add(new StepField("command[" + i + "]", step.command().get(i), true));
        }
        for (int i = 0; i < step.args().size(); i++) {
            fields.add(new StepField("arg[" + i + "]", step.args().get(i), true));
        }
        for (EnvVar env : step.env()) {
            fields.add(new StepField("env[" + env.name() + "]", env.value(), false));
        }
        for (int i = 0; i < step.volumeMounts().size(); i++) {
            VolumeMount vm = step.volumeMounts().get(i);
            String prefix = "volumeMount[" + i + "].";
            fields.add(new StepField(prefix + "Name", vm.name(), false));
            fields.add(new StepField(prefix + "MountPath", vm.mountPath(), false));
            fields.add(new StepField(prefix + "SubPath", vm.subPath(), false));
        }
        return fields;
    }
}

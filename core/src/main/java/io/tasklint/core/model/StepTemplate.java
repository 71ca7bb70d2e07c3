package io.tasklint.core.model;

import java.util.List;

/**
 * Container defaults shared by every step of a task. Each step is merged on top of the template
 * before structural checks run.
 *
 * @param image        default image
 * @param command      default entrypoint tokens
 * @param args         default argument tokens
 * @param workingDir   default working directory
 * @param env          environment variables merged by name
 * @param volumeMounts volume mounts merged by mount path
 */
public record StepTemplate(
        String image,
        List<String> command,
        List<String> args,
        String workingDir,
        List<EnvVar> env,
        List<VolumeMount> volumeMounts) {

    public StepTemplate {
        image = image != null ? image : "";
        workingDir = workingDir != null ? workingDir : "";
        command = command != null ? List.copyOf(command) : List.of();
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? List.copyOf(env) : List.of();
        volumeMounts = volumeMounts != null ? List.copyOf(volumeMounts) : List.of();
    }
}

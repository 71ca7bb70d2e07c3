package io.tasklint.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One execution unit of a task: a container image plus how to run it.
 *
 * <p>
 * Immutable, thread-safe. Unset strings are normalized to {@code ""} and unset
 * lists to empty lists, so that validation never has to distinguish the two.
 *
 * @param name         optional step name (DNS label when present)
 * @param image        container image, required
 * @param command      entrypoint tokens
 * @param args         argument tokens
 * @param script       inline script body; mutually exclusive with {@code command}
 * @param workingDir   working directory inside the container
 * @param env          environment variables in declaration order
 * @param volumeMounts volume mounts in declaration order
 */
public record Step(
        String name,
        String image,
        List<String> command,
        List<String> args,
        String script,
        String workingDir,
        List<EnvVar> env,
        List<VolumeMount> volumeMounts) {

    public Step {
        name = name != null ? name : "";
        image = image != null ? image : "";
        script = script != null ? script : "";
        workingDir = workingDir != null ? workingDir : "";
        command = command != null ? List.copyOf(command) : List.of();
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? List.copyOf(env) : List.of();
        volumeMounts = volumeMounts != null ? List.copyOf(volumeMounts) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this step's values. */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .image(image)
                .command(command)
                .args(args)
                .script(script)
                .workingDir(workingDir)
                .env(env)
                .volumeMounts(volumeMounts);
    }

    /** Builder for {@link Step}. */
    public static final class Builder {
        private String name;
        private String image;
        private List<String> command = new ArrayList<>();
        private List<String> args = new ArrayList<>();
        private String script;
        private String workingDir;
        private List<EnvVar> env = new ArrayList<>();
        private List<VolumeMount> volumeMounts = new ArrayList<>();

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder command(List<String> command) {
            this.command = new ArrayList<>(command);
            return this;
        }

        public Builder command(String... command) {
            return command(List.of(command));
        }

        public Builder args(List<String> args) {
            this.args = new ArrayList<>(args);
            return this;
        }

        public Builder args(String... args) {
            return args(List.of(args));
        }

        public Builder script(String script) {
            this.script = script;
            return this;
        }

        public Builder workingDir(String workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public Builder env(List<EnvVar> env) {
            this.env = new ArrayList<>(env);
            return this;
        }

        public Builder addEnv(String name, String value) {
            this.env.add(new EnvVar(name, value));
            return this;
        }

        public Builder volumeMounts(List<VolumeMount> volumeMounts) {
            this.volumeMounts = new ArrayList<>(volumeMounts);
            return this;
        }

        public Builder addVolumeMount(VolumeMount volumeMount) {
            this.volumeMounts.add(volumeMount);
            return this;
        }

        public Step build() {
            return new Step(
                    name,
                    image,
                    Collections.unmodifiableList(command),
                    Collections.unmodifiableList(args),
                    script,
                    workingDir,
                    env,
                    volumeMounts);
        }
    }
}

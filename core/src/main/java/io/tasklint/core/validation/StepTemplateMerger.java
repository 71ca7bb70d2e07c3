package io.tasklint.core.validation;

import io.tasklint.core.model.EnvVar;
import io.tasklint.core.model.Step;
import io.tasklint.core.model.StepTemplate;
import io.tasklint.core.model.VolumeMount;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Applies a {@link StepTemplate} underneath each step.
 *
 * <p>
 * Step values win: non-empty strings override the template, non-empty
 * command/args replace it. Env entries are merged by name and volume mounts by
 * mount path; template entries keep their position (taking the step's entry
 * when the keys match) and the step's remaining entries follow.
 */
final class StepTemplateMerger {

    private StepTemplateMerger() {
        // utility class
    }

    /**
     * Merges every step with the template. Returns {@code steps} unchanged when there is no
     * template.
     */
    static List<Step> merge(StepTemplate template, List<Step> steps) {
        if (template == null) {
            return steps;
        }
        List<Step> merged = new ArrayList<>(steps.size());
        for (Step step : steps) {
            merged.add(merge(template, step));
        }
        return merged;
    }

    static Step merge(StepTemplate template, Step step) {
        return step.toBuilder()
                .image(step.image().isEmpty() ? template.image() : step.image())
                .command(step.command().isEmpty() ? template.command() : step.command())
                .args(step.args().isEmpty() ? template.args() : step.args())
                .workingDir(step.workingDir().isEmpty() ? template.workingDir() : step.workingDir())
                .env(mergeByKey(template.env(), step.env(), EnvVar::name))
                .volumeMounts(mergeByKey(template.volumeMounts(), step.volumeMounts(), VolumeMount::mountPath))
                .build();
    }

    private static <T> List<T> mergeByKey(List<T> base, List<T> overlay, Function<T, String> key) {
        Map<String, T> overrides = new LinkedHashMap<>();
        for (T item : overlay) {
            overrides.putIfAbsent(key.apply(item), item);
        }
        List<T> merged = new ArrayList<>(base.size() + overlay.size());
        Set<String> baseKeys = new HashSet<>();
        for (T item : base) {
            String k = key.apply(item);
            baseKeys.add(k);
            merged.add(overrides.getOrDefault(k, item));
        }
        for (T item : overlay) {
            if (!baseKeys.contains(key.apply(item))) {
                merged.add(item);
            }
        }
        return merged;
    }
}

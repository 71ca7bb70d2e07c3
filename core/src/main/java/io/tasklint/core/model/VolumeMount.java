package io.tasklint.core.model;

/**
 * A volume mounted into a step container.
 *
 * @param name      name of the mounted volume
 * @param mountPath path inside the container
 * @param subPath   optional sub path within the volume ({@code ""} if unset)
 */
public record VolumeMount(String name, String mountPath, String subPath) {

    public VolumeMount {
        name = name != null ? name : "";
        mountPath = mountPath != null ? mountPath : "";
        subPath = subPath != null ? subPath : "";
    }

    public static VolumeMount of(String name, String mountPath) {
        return new VolumeMount(name, mountPath, "");
    }
}

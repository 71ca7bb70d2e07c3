package io.tasklint.core.model;

/**
 * A resource a task consumes or produces.
 *
 * @param name       resource name, unique (ignoring case) within its direction
 * @param type       resource type as written
 * @param targetPath optional path the resource is placed at, may be null
 * @param optional   whether the resource may be omitted at run time
 */
public record TaskResource(String name, String type, String targetPath, boolean optional) {

    public TaskResource {
        name = name != null ? name : "";
        type = type != null ? type : "";
    }

    public static TaskResource of(String name, ResourceType type) {
        return new TaskResource(name, type.wireName(), null, false);
    }
}

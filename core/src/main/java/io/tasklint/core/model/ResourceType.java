package io.tasklint.core.model;

import java.util.Arrays;
import java.util.Optional;

/** The resource kinds a task may declare as input or output. */
public enum ResourceType {
    GIT("git"),
    STORAGE("storage"),
    IMAGE("image"),
    CLUSTER("cluster"),
    PULL_REQUEST("pullRequest"),
    CLOUD_EVENT("cloudEvent");

    private final String wireName;

    ResourceType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Looks up a resource type by its document spelling (case-sensitive). */
    public static Optional<ResourceType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}

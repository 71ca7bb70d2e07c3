package io.tasklint.core.model;

/**
 * A workspace the task expects to be bound at run time.
 *
 * @param name        workspace name, unique within the task
 * @param description free-form description, may be null
 * @param mountPath   explicit mount path, {@code ""} when the default applies
 * @param readOnly    whether steps may only read the workspace
 */
public record WorkspaceDeclaration(String name, String description, String mountPath, boolean readOnly) {

    /** Directory under which workspaces without an explicit mount path are mounted. */
    public static final String WORKSPACE_DIR = "/workspace";

    public WorkspaceDeclaration {
        name = name != null ? name : "";
        mountPath = mountPath != null ? mountPath : "";
    }

    public static WorkspaceDeclaration of(String name) {
        return new WorkspaceDeclaration(name, null, "", false);
    }

    public static WorkspaceDeclaration of(String name, String mountPath) {
        return new WorkspaceDeclaration(name, null, mountPath, false);
    }

    /**
     * Returns the explicit mount path, or {@code /workspace/<name>} when none was declared. The
     * result is not cleaned.
     */
    public String resolvedMountPath() {
        if (!mountPath.isEmpty()) {
            return mountPath;
        }
        return WORKSPACE_DIR + "/" + name;
    }
}

package io.tasklint.core.model;

/**
 * Object metadata of a {@link Task}. Only carried through; the rules that apply to it live behind
 * {@code ObjectMetaValidator}.
 *
 * @param name      object name, may be null
 * @param namespace object namespace, may be null
 */
public record ObjectMeta(String name, String namespace) {

    /** Metadata with neither name nor namespace. */
    public static ObjectMeta empty() {
        return new ObjectMeta(null, null);
    }
}

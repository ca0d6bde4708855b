package io.exprxform.core.engine;

import io.exprxform.core.model.Transform;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable catalog of transforms keyed by transform id. Rule sets name transforms by id and are
 * resolved against a registry.
 *
 * <p>Thread-safe: all fields are final and the map is unmodifiable.
 */
public final class TransformRegistry {

    private final Map<String, Transform> transforms;

    /**
     * Creates a registry over the given transforms. The map is defensively copied; the caller may
     * mutate the original after construction without affecting this registry.
     *
     * @param transforms map of transform id to transform
     */
    public TransformRegistry(Map<String, Transform> transforms) {
        this.transforms = Collections.unmodifiableMap(new LinkedHashMap<>(transforms));
    }

    /** Creates an empty registry. */
    public static TransformRegistry empty() {
        return new TransformRegistry(Map.of());
    }

    /** Creates a registry holding the shipped transforms. */
    public static TransformRegistry withBuiltins() {
        Builder builder = builder();
        BuiltinTransforms.defaults().forEach(builder::addTransform);
        return builder.build();
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a transform by id.
     *
     * @param id the transform id
     * @return the transform, or null if not registered
     */
    public Transform getTransform(String id) {
        return transforms.get(id);
    }

    /** Returns an unmodifiable view of all registered transforms, in registration order. */
    public Map<String, Transform> allTransforms() {
        return transforms;
    }

    /**
     * Number of registered transforms.
     *
     * @return the transform count
     */
    public int size() {
        return transforms.size();
    }

    /** Builder for constructing a {@link TransformRegistry} incrementally. */
    public static final class Builder {

        private final Map<String, Transform> transforms = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers a transform under its id, replacing any transform with the same id.
         *
         * @param transform the transform to register
         * @return this builder (fluent)
         */
        public Builder addTransform(Transform transform) {
            transforms.put(transform.id(), transform);
            return this;
        }

        /**
         * Builds an immutable registry from the transforms added so far.
         *
         * @return a new registry; later changes to this builder do not affect it
         */
        public TransformRegistry build() {
            return new TransformRegistry(transforms);
        }
    }
}

package io.exprxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An ordered list of transforms resolved from a rule-set file. The driver applies the transforms
 * one pass each, in list order.
 *
 * @param id          rule-set identifier
 * @param description free-form description, may be null
 * @param transforms  resolved transforms in application order (immutable copy)
 */
public record RuleSet(String id, String description, List<Transform> transforms) {

    public RuleSet {
        Objects.requireNonNull(id, "id must not be null");
        transforms = List.copyOf(Objects.requireNonNull(transforms, "transforms must not be null"));
    }

    /** Returns the transform ids in application order. */
    public List<String> transformIds() {
        return transforms.stream().map(Transform::id).toList();
    }
}

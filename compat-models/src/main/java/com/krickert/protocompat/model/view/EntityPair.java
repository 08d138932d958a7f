package com.krickert.protocompat.model.view;

import java.util.Optional;

/**
 * The original and updated revision of one schema entity, matched by the caller.
 * <p>
 * Exactly one side may be absent: a missing original is an addition, a missing update is a removal.
 * A pair with both sides absent cannot be constructed.
 *
 * @param <T> the entity view type
 */
public final class EntityPair<T> {

    private final T original;
    private final T updated;

    private EntityPair(T original, T updated) {
        if (original == null && updated == null) {
            throw new IllegalArgumentException("At least one of the original and updated entities must be present.");
        }
        this.original = original;
        this.updated = updated;
    }

    public static <T> EntityPair<T> of(T original, T updated) {
        return new EntityPair<>(original, updated);
    }

    public static <T> EntityPair<T> added(T updated) {
        if (updated == null) {
            throw new IllegalArgumentException("An added entity cannot be null.");
        }
        return new EntityPair<>(null, updated);
    }

    public static <T> EntityPair<T> removed(T original) {
        if (original == null) {
            throw new IllegalArgumentException("A removed entity cannot be null.");
        }
        return new EntityPair<>(original, null);
    }

    public Optional<T> original() {
        return Optional.ofNullable(original);
    }

    public Optional<T> updated() {
        return Optional.ofNullable(updated);
    }

    public boolean isAddition() {
        return original == null;
    }

    public boolean isRemoval() {
        return updated == null;
    }

    /**
     * @throws IllegalStateException when the original side is absent
     */
    public T requireOriginal() {
        if (original == null) {
            throw new IllegalStateException("Original entity is absent.");
        }
        return original;
    }

    /**
     * @throws IllegalStateException when the updated side is absent
     */
    public T requireUpdated() {
        if (updated == null) {
            throw new IllegalStateException("Updated entity is absent.");
        }
        return updated;
    }

    @Override
    public String toString() {
        return "EntityPair{original=" + original + ", updated=" + updated + '}';
    }
}

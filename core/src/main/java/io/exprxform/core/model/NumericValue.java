package io.exprxform.core.model;

/**
 * Value slot of a {@link NumericLiteral}: either a concrete unsigned 64-bit integer or the
 * {@link Wildcard} placeholder used by patterns.
 *
 * <p>The concrete value is stored in a {@code long} and read as unsigned everywhere it is
 * rendered or compared for ordering. Equality is plain bit equality.
 */
public sealed interface NumericValue {

    /** Returns a concrete value. */
    static NumericValue of(long value) {
        return new Concrete(value);
    }

    /** Returns the wildcard placeholder. */
    static NumericValue wildcard() {
        return Wildcard.INSTANCE;
    }

    /** Returns {@code true} if this is the wildcard placeholder. */
    boolean isWildcard();

    /** A concrete unsigned integer. */
    record Concrete(long value) implements NumericValue {

        @Override
        public boolean isWildcard() {
            return false;
        }

        @Override
        public String toString() {
            return Long.toUnsignedString(value);
        }
    }

    /** Matches any concrete value and any other wildcard. Carries no payload. */
    enum Wildcard implements NumericValue {
        INSTANCE;

        @Override
        public boolean isWildcard() {
            return true;
        }

        @Override
        public String toString() {
            return "?";
        }
    }
}

package dev.flows.model;

/**
 * A step's input transform: either a built-in referenced by name, or a caller-supplied function.
 */
public sealed interface TransformSpec {

    TransformSpec PASSTHROUGH = new Named("passthrough");

    /** Display name used in events and error messages. */
    String displayName();

    record Named(String name) implements TransformSpec {
        @Override
        public String displayName() { return name; }
    }

    record Custom(Transform function) implements TransformSpec {
        @Override
        public String displayName() { return "custom"; }
    }

    static TransformSpec named(String name) {
        return new Named(name);
    }

    static TransformSpec custom(Transform function) {
        return new Custom(function);
    }

    /** Caller-supplied transform. Thrown exceptions fail the step. */
    @FunctionalInterface
    interface Transform {
        String apply(String input) throws Exception;
    }
}

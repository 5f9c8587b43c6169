package org.kasd.compiler;

import org.kasd.compiler.diagnostics.Diagnostic;

import java.util.Optional;
import java.util.function.Function;

/**
 * The outcome of one pipeline stage: either a value or the diagnostic that stopped the stage.
 * A successful result may carry a {@code null} value, e.g. an analysis pass over an empty tree.
 *
 * @param value The produced value; meaningful only on success.
 * @param diagnostic The diagnostic on failure, {@code null} on success.
 * @param <T> The type of the produced value.
 */
public record PhaseResult<T>(T value, Diagnostic diagnostic) {

    /**
     * Creates a successful result.
     * @param value The produced value.
     * @param <T> The value type.
     * @return The result.
     */
    public static <T> PhaseResult<T> success(T value) {
        return new PhaseResult<>(value, null);
    }

    /**
     * Creates a failed result.
     * @param diagnostic The diagnostic explaining the failure, not null.
     * @param <T> The value type.
     * @return The result.
     */
    public static <T> PhaseResult<T> failure(Diagnostic diagnostic) {
        if (diagnostic == null) {
            throw new IllegalArgumentException("A failed phase result needs a diagnostic.");
        }
        return new PhaseResult<>(null, diagnostic);
    }

    /**
     * @return {@code true} if the stage completed without a diagnostic.
     */
    public boolean isSuccess() {
        return diagnostic == null;
    }

    /**
     * Returns the diagnostic of a failed stage.
     * @return The diagnostic, or empty on success.
     */
    public Optional<Diagnostic> failureDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    /**
     * Chains the next stage onto a successful result. A failure is passed through unchanged.
     * @param next The next stage.
     * @param <R> The next stage's value type.
     * @return The next stage's result, or this failure.
     */
    public <R> PhaseResult<R> then(Function<? super T, PhaseResult<R>> next) {
        if (!isSuccess()) {
            return failure(diagnostic);
        }
        return next.apply(value);
    }
}

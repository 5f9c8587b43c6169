package org.kasd.compiler;

import org.kasd.compiler.diagnostics.Diagnostic;
import org.kasd.runtime.value.Value;

import java.util.Map;
import java.util.Optional;

/**
 * The outcome of running one compilation unit through the {@link Pipeline}.
 *
 * @param value The value of the executed statement, {@link Value#NULL} if the run failed.
 * @param diagnostic The diagnostic that stopped the run, or {@code null} on success.
 * @param bindings The interpreter's bindings after the run; empty if interpretation did not run.
 */
public record ExecutionResult(Value value, Diagnostic diagnostic, Map<String, Value> bindings) {

    static ExecutionResult success(Value value, Map<String, Value> bindings) {
        return new ExecutionResult(value, null, bindings);
    }

    static ExecutionResult failure(Diagnostic diagnostic) {
        return new ExecutionResult(Value.NULL, diagnostic, Map.of());
    }

    /**
     * @return {@code true} if every stage completed without a diagnostic.
     */
    public boolean isSuccess() {
        return diagnostic == null;
    }

    /**
     * @return The diagnostic of a failed run, or empty on success.
     */
    public Optional<Diagnostic> failureDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }
}

package org.javai.martial.compile;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.martial.graph.MartialGraph;
import org.javai.martial.lang.CompileError;
import org.javai.martial.semantic.MartialSystem;

/**
 * Outcome of compiling a martial system: the validated system with its graph, or
 * the errors that prevented them.
 */
public record CompilationResult(
		MartialSystem system,
		MartialGraph graph,
		List<CompileError> errors
) {

	public CompilationResult {
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public static CompilationResult success(MartialSystem system, MartialGraph graph) {
		return new CompilationResult(
				Objects.requireNonNull(system, "system must not be null"),
				Objects.requireNonNull(graph, "graph must not be null"),
				List.of());
	}

	public static CompilationResult failure(List<? extends CompileError> errors) {
		if (errors == null || errors.isEmpty()) {
			throw new IllegalArgumentException("A failed compilation must report at least one error");
		}
		return new CompilationResult(null, null, List.copyOf(errors));
	}

	public boolean isSuccess() {
		return system != null && errors.isEmpty();
	}

	/**
	 * Errors rendered one per line, in report order.
	 */
	public String describeErrors() {
		return errors.stream()
				.map(CompileError::describe)
				.collect(Collectors.joining(System.lineSeparator()));
	}
}

package org.javai.martial.semantic;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of analyzing a set of parsed files: a validated system or the errors
 * that prevented one.
 */
public record AnalysisResult(
		MartialSystem system,
		List<SemanticError> errors
) {

	public AnalysisResult {
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public static AnalysisResult success(MartialSystem system) {
		return new AnalysisResult(Objects.requireNonNull(system, "system must not be null"), List.of());
	}

	public static AnalysisResult failure(List<SemanticError> errors) {
		if (errors == null || errors.isEmpty()) {
			throw new IllegalArgumentException("A failed analysis must report at least one error");
		}
		return new AnalysisResult(null, errors);
	}

	public boolean isSuccess() {
		return system != null && errors.isEmpty();
	}
}

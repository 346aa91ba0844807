package org.javai.martial.semantic;

import org.javai.martial.lang.CompileError;
import org.javai.martial.lang.SourcePosition;

/**
 * Structured violation of the martial model found while analyzing a merged system.
 *
 * @param kind the violated rule
 * @param message human-readable description
 * @param reference the symbol the error concerns (state, role, sequence, action or group name)
 * @param position where the offending declaration was written, {@code null} for system-wide errors
 */
public record SemanticError(Kind kind, String message, String reference, SourcePosition position)
		implements CompileError {

	public enum Kind {
		MISSING_ROLES,
		DUPLICATE_ROLE,
		DUPLICATE_STATE,
		DUPLICATE_STATE_ROLE,
		UNDECLARED_ROLE,
		DUPLICATE_SEQUENCE,
		DUPLICATE_ACTION,
		UNDECLARED_STATE,
		INVALID_NODE_REFERENCE,
		BROKEN_CHAIN,
		DUPLICATE_GROUP,
		EMPTY_GROUP
	}

	@Override
	public String describe() {
		String where = position != null ? " at " + position : "";
		return "Semantic error [" + kind + "]" + where + ": " + message;
	}
}

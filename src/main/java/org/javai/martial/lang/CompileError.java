package org.javai.martial.lang;

/**
 * A structured error reported by one of the compilation stages:
 * {@link LexError}, {@link ParseError} or
 * {@link org.javai.martial.semantic.SemanticError}.
 */
public interface CompileError {

	/**
	 * The stage-specific kind of this error.
	 */
	Enum<?> kind();

	String message();

	/**
	 * One-line rendering including kind and location.
	 */
	String describe();
}

package org.javai.martial.lang;

/**
 * Base exception for failures while reading a martial source file.
 */
public abstract class MartialException extends RuntimeException {

	protected MartialException(String message) {
		super(message);
	}

	/**
	 * The structured error carried by this exception.
	 */
	public abstract CompileError error();
}

package org.javai.martial.lang;

/**
 * Location of a token or declaration in a source file.
 *
 * @param file the file identifier the text came from
 * @param line 1-based line number
 * @param column 1-based column number
 */
public record SourcePosition(String file, int line, int column) {

	@Override
	public String toString() {
		return file + ":" + line + ":" + column;
	}
}

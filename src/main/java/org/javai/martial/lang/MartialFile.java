package org.javai.martial.lang;

import java.util.List;

/**
 * The declarations parsed from one source file, in source order.
 */
public record MartialFile(String fileId, List<Declaration> declarations) {

	public MartialFile {
		declarations = declarations != null ? List.copyOf(declarations) : List.of();
	}
}

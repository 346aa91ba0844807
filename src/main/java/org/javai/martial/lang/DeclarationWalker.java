package org.javai.martial.lang;

import java.util.List;

/**
 * Utility class for walking parsed files with visitors.
 */
public final class DeclarationWalker {

	private DeclarationWalker() {
	}

	/**
	 * Visits every declaration of every file, files in list order and
	 * declarations in source order.
	 *
	 * @param <R> the return type of the visitor
	 * @param files the parsed files
	 * @param visitor the visitor to apply to each declaration
	 */
	public static <R> void walkAll(List<MartialFile> files, DeclarationVisitor<R> visitor) {
		if (files == null) {
			return;
		}

		for (MartialFile file : files) {
			walk(file, visitor);
		}
	}

	/**
	 * Visits the declarations of a single file in source order.
	 */
	public static <R> void walk(MartialFile file, DeclarationVisitor<R> visitor) {
		for (Declaration declaration : file.declarations()) {
			declaration.accept(visitor);
		}
	}
}

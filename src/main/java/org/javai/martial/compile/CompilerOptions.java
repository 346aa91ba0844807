package org.javai.martial.compile;

/**
 * Options for a compilation run.
 *
 * @param parallelFrontEnd lex and parse files concurrently before semantic analysis
 * @param frontEndThreads size of the thread pool used when {@code parallelFrontEnd} is set
 */
public record CompilerOptions(
		boolean parallelFrontEnd,
		int frontEndThreads
) {

	public CompilerOptions {
		if (frontEndThreads < 1) {
			throw new IllegalArgumentException("frontEndThreads must be at least 1, was " + frontEndThreads);
		}
	}

	public static CompilerOptions defaults() {
		return new CompilerOptions(false, 1);
	}

	public static CompilerOptions parallel(int threads) {
		return new CompilerOptions(true, threads);
	}
}

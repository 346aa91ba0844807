package org.javai.martial.testsupport;

import java.util.ArrayList;
import java.util.List;
import org.javai.martial.lang.MartialFile;
import org.javai.martial.semantic.AnalysisResult;
import org.javai.martial.semantic.MartialSystem;
import org.javai.martial.semantic.SemanticAnalyzer;

/**
 * Builds validated systems from source text for tests that start after analysis.
 */
public final class TestSystems {

	private TestSystems() {
	}

	public static MartialSystem validSystem(String name, String... sources) {
		List<MartialFile> files = new ArrayList<>();
		for (int i = 0; i < sources.length; i++) {
			files.add(MartialSources.parse(name + "-" + i + ".martial", sources[i]));
		}
		AnalysisResult result = new SemanticAnalyzer().analyze(name, files);
		if (!result.isSuccess()) {
			throw new IllegalStateException("Test system '" + name + "' is invalid: " + result.errors());
		}
		return result.system();
	}
}

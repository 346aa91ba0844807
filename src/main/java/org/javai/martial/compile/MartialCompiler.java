package org.javai.martial.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.javai.martial.graph.GraphBuilder;
import org.javai.martial.graph.MartialGraph;
import org.javai.martial.lang.CompileError;
import org.javai.martial.lang.MartialException;
import org.javai.martial.lang.MartialFile;
import org.javai.martial.lang.MartialParser;
import org.javai.martial.lang.MartialToken;
import org.javai.martial.lang.MartialTokenizer;
import org.javai.martial.semantic.AnalysisResult;
import org.javai.martial.semantic.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full pipeline over the files of one system: tokenize and parse every
 * file, analyze the merged declarations, then derive the transition graph.
 * <p>
 * Files are processed in ascending file-id order so repeated runs over the same
 * input report identical errors and build identical graphs. A lex or parse error
 * stops only the file it occurs in; the remaining files are still read so that
 * every syntax error of the run is reported. Semantic analysis starts only when
 * all files parsed cleanly.
 * <p>
 * The compiler never writes to standard streams and never exits the process;
 * rendering the result is up to the caller.
 */
public class MartialCompiler {

	private static final Logger logger = LoggerFactory.getLogger(MartialCompiler.class);

	private final CompilerOptions options;
	private final SemanticAnalyzer analyzer;

	public MartialCompiler() {
		this(CompilerOptions.defaults());
	}

	public MartialCompiler(CompilerOptions options) {
		this(options, new SemanticAnalyzer());
	}

	public MartialCompiler(CompilerOptions options, SemanticAnalyzer analyzer) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
	}

	/**
	 * Creates a compiler configured from {@value CompilerOptionsLoader#DEFAULT_RESOURCE}
	 * on the given class loader.
	 */
	public static MartialCompiler fromClasspath(ClassLoader loader) {
		return new MartialCompiler(new CompilerOptionsLoader().loadDefault(loader));
	}

	/**
	 * Compiles one system.
	 *
	 * @param systemName opaque label for the system
	 * @param sources file id to source text for every file of the system
	 * @return the validated system and its graph, or every error found
	 */
	public CompilationResult compile(String systemName, Map<String, String> sources) {
		Objects.requireNonNull(systemName, "systemName must not be null");
		Objects.requireNonNull(sources, "sources must not be null");

		Map<String, String> ordered = new TreeMap<>(sources);
		logger.debug("Compiling system '{}' from {} file(s)", systemName, ordered.size());

		List<FrontEndResult> frontEnd = options.parallelFrontEnd() && ordered.size() > 1
				? readInParallel(ordered)
				: readSequentially(ordered);

		List<MartialFile> files = new ArrayList<>();
		List<CompileError> syntaxErrors = new ArrayList<>();
		for (FrontEndResult result : frontEnd) {
			if (result.error() != null) {
				syntaxErrors.add(result.error());
			}
			else {
				files.add(result.file());
			}
		}
		if (!syntaxErrors.isEmpty()) {
			logger.info("System '{}' has syntax errors in {} of {} file(s)", systemName, syntaxErrors.size(), ordered.size());
			return CompilationResult.failure(syntaxErrors);
		}

		AnalysisResult analysis = analyzer.analyze(systemName, files);
		if (!analysis.isSuccess()) {
			logger.info("System '{}' failed validation with {} error(s)", systemName, analysis.errors().size());
			return CompilationResult.failure(analysis.errors());
		}

		MartialGraph graph = GraphBuilder.build(analysis.system());
		logger.info("System '{}' compiled: {} node(s), {} edge(s)", systemName, graph.nodes().size(), graph.edges().size());
		return CompilationResult.success(analysis.system(), graph);
	}

	/**
	 * Tokenizes and parses a single file.
	 *
	 * @throws org.javai.martial.lang.LexException on a malformed character
	 * @throws org.javai.martial.lang.ParseException on a malformed token sequence
	 */
	public static MartialFile parseFile(String fileId, String source) {
		List<MartialToken> tokens = new MartialTokenizer(fileId, source).tokenize();
		return new MartialParser(fileId, tokens).parse();
	}

	private List<FrontEndResult> readSequentially(Map<String, String> sources) {
		List<FrontEndResult> results = new ArrayList<>();
		sources.forEach((fileId, source) -> results.add(read(fileId, source)));
		return results;
	}

	private List<FrontEndResult> readInParallel(Map<String, String> sources) {
		ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.frontEndThreads(), sources.size()));
		try {
			List<Future<FrontEndResult>> futures = new ArrayList<>();
			sources.forEach((fileId, source) -> futures.add(executor.submit(() -> read(fileId, source))));

			// joined in submission order, which is file-id order
			List<FrontEndResult> results = new ArrayList<>();
			for (Future<FrontEndResult> future : futures) {
				results.add(future.get());
			}
			return results;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while reading source files", e);
		}
		catch (ExecutionException e) {
			throw new IllegalStateException("Failed to read source files", e.getCause());
		}
		finally {
			executor.shutdownNow();
		}
	}

	private FrontEndResult read(String fileId, String source) {
		try {
			MartialFile file = parseFile(fileId, source);
			logger.debug("Parsed {}: {} declaration(s)", fileId, file.declarations().size());
			return new FrontEndResult(file, null);
		}
		catch (MartialException e) {
			logger.debug("Failed to read {}: {}", fileId, e.getMessage());
			return new FrontEndResult(null, e.error());
		}
	}

	private record FrontEndResult(MartialFile file, CompileError error) {
	}
}

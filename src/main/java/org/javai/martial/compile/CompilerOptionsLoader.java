package org.javai.martial.compile;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link CompilerOptions} from YAML.
 *
 * <pre>
 * front_end:
 *   parallel: true
 *   threads: 4
 * </pre>
 *
 * Missing keys fall back to {@link CompilerOptions#defaults()}.
 */
public class CompilerOptionsLoader {

	private static final Logger logger = LoggerFactory.getLogger(CompilerOptionsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/martial-compiler.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load options from {@link #DEFAULT_RESOURCE}, or the defaults when the
	 * resource is absent.
	 */
	public CompilerOptions loadDefault(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (is == null) {
				logger.warn("No {} on the classpath; using default compiler options", DEFAULT_RESOURCE);
				return CompilerOptions.defaults();
			}
			return load(is, DEFAULT_RESOURCE);
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load compiler options from resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public CompilerOptions load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path)) {
			return fromMap(yaml.load(reader), path.toString());
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load compiler options from path: " + path, e);
		}
	}

	public CompilerOptions loadString(String yamlContent) {
		try {
			return fromMap(yaml.load(yamlContent), "string");
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load compiler options from string", e);
		}
	}

	private CompilerOptions load(InputStream inputStream, String source) {
		try {
			return fromMap(yaml.load(inputStream), source);
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load compiler options from " + source, e);
		}
	}

	private CompilerOptions fromMap(Object document, String source) {
		CompilerOptions defaults = CompilerOptions.defaults();
		if (document == null) {
			return defaults;
		}
		if (!(document instanceof Map<?, ?> root)) {
			throw new IllegalStateException("Compiler options in " + source + " must be a mapping");
		}
		Object frontEnd = root.get("front_end");
		if (frontEnd == null) {
			return defaults;
		}
		if (!(frontEnd instanceof Map<?, ?> frontEndMap)) {
			throw new IllegalStateException("'front_end' in " + source + " must be a mapping");
		}

		boolean parallel = booleanValue(frontEndMap.get("parallel"), defaults.parallelFrontEnd(), "front_end.parallel", source);
		int threads = intValue(frontEndMap.get("threads"), defaults.frontEndThreads(), "front_end.threads", source);
		try {
			CompilerOptions options = new CompilerOptions(parallel, threads);
			logger.debug("Loaded compiler options from {}: {}", source, options);
			return options;
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException("Invalid compiler options in " + source + ": " + e.getMessage(), e);
		}
	}

	private boolean booleanValue(Object value, boolean fallback, String key, String source) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new IllegalStateException("'" + key + "' in " + source + " must be a boolean, was: " + value);
	}

	private int intValue(Object value, int fallback, String key, String source) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof Integer i) {
			return i;
		}
		throw new IllegalStateException("'" + key + "' in " + source + " must be an integer, was: " + value);
	}
}

package org.javai.pdx.target;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.javai.pdx.config.MultiplySettings;
import org.javai.pdx.script.PdxExpression;
import org.javai.pdx.script.PdxParseException;
import org.javai.pdx.script.PdxParser;
import org.javai.pdx.script.PdxPrinter;
import org.javai.pdx.script.PdxSchemaException;
import org.javai.pdx.transform.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors a source "common" directory into a destination, multiplying modifiers on the
 * way.
 *
 * Each eligible file is parsed, transformed and, only if something was multiplied,
 * printed to the same relative path under the destination. Ignored directory names are
 * not entered, and loose files directly inside a directory named like the root directory
 * are skipped. Files whose parent directory is the static directory are transformed in
 * static mode.
 */
public class TargetWalker {

	private static final Logger logger = LoggerFactory.getLogger(TargetWalker.class);

	private final PdxParser parser;
	private final PdxPrinter printer;
	private final TreeTransformer transformer;
	private final MultiplySettings settings;

	public TargetWalker(PdxParser parser, TreeTransformer transformer, MultiplySettings settings) {
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.transformer = Objects.requireNonNull(transformer, "transformer must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.printer = new PdxPrinter();
	}

	private record Pending(Path source, Path destination) {
	}

	/**
	 * Walks {@code source}, writing changed files under {@code destination}.
	 *
	 * @throws PdxParseException if a file is malformed and continue-on-error is off
	 * @throws PdxSchemaException if a static file is malformed and continue-on-error is off
	 * @throws IOException if reading a directory or writing a file fails
	 */
	public WalkResult walk(Path source, Path destination) throws IOException {
		int processed = 0;
		List<Path> written = new ArrayList<>();
		List<Path> failed = new ArrayList<>();

		Deque<Pending> stack = new ArrayDeque<>();
		stack.push(new Pending(source, destination));
		while (!stack.isEmpty()) {
			Pending next = stack.pop();
			if (Files.isDirectory(next.source())) {
				for (Path child : children(next.source())) {
					if (isSkipped(next.source(), child)) {
						continue;
					}
					stack.push(new Pending(child, next.destination().resolve(child.getFileName().toString())));
				}
				continue;
			}

			processed++;
			Optional<List<PdxExpression>> tree;
			try {
				tree = processFile(next.source());
			} catch (PdxParseException | PdxSchemaException e) {
				if (!settings.continueOnError()) {
					throw e;
				}
				logger.error("  Failed to process '{}': {}", next.source(), e.getMessage());
				failed.add(next.source());
				continue;
			}

			if (tree.isPresent()) {
				write(tree.get(), next.destination());
				written.add(next.destination());
				logger.info("  Changes written to '{}'.", next.destination());
			} else {
				logger.info("  Skipping write, no changes made.");
			}
		}
		return new WalkResult(processed, written, failed);
	}

	/**
	 * Parses and transforms one file.
	 *
	 * @return the transformed tree, or empty if nothing was multiplied
	 */
	Optional<List<PdxExpression>> processFile(Path path) throws IOException {
		logger.info("Processing '{}':", path);
		List<PdxExpression> tree = parser.parseFile(path, settings.encoding());
		boolean changed;
		if (isStatic(path)) {
			changed = transformer.transformStatic(tree, settings.ignoreStatic(), path.toString());
		} else {
			changed = transformer.transform(tree, path.toString());
		}
		return changed ? Optional.of(tree) : Optional.empty();
	}

	private boolean isSkipped(Path parent, Path child) {
		String name = child.getFileName().toString();
		if (settings.ignoreDirs().contains(name)) {
			return true;
		}
		return settings.rootDirectory().equals(fileName(parent)) && Files.isRegularFile(child);
	}

	private boolean isStatic(Path file) {
		Path parent = file.getParent();
		return parent != null && settings.staticDirectory().equals(fileName(parent));
	}

	private void write(List<PdxExpression> tree, Path destination) throws IOException {
		Path parent = destination.getParent();
		if (parent != null && !Files.exists(parent)) {
			Files.createDirectories(parent);
		}
		try (Writer writer = Files.newBufferedWriter(destination, settings.encoding())) {
			printer.write(tree, writer);
		} catch (UncheckedIOException e) {
			throw e.getCause();
		}
	}

	private static List<Path> children(Path dir) throws IOException {
		try (Stream<Path> entries = Files.list(dir)) {
			return entries.sorted().toList();
		}
	}

	private static String fileName(Path path) {
		Path name = path.toAbsolutePath().normalize().getFileName();
		return name != null ? name.toString() : "";
	}
}

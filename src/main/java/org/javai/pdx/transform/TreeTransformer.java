package org.javai.pdx.transform;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.pdx.modifier.ModifierTable;
import org.javai.pdx.script.PdxBlock;
import org.javai.pdx.script.PdxExpression;
import org.javai.pdx.script.PdxNumber;
import org.javai.pdx.script.PdxPrinter;
import org.javai.pdx.script.PdxValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multiplies modifier values in a parsed tree, in place.
 *
 * Traversal is depth first. The subtree under any key in the ignore-block set
 * (triggers, chances, AI weights) is never visited. A key found in the modifier table
 * whose value is a number is multiplied; with any other scalar value it is reported and
 * left alone.
 *
 * Transforming the same tree twice multiplies twice. Callers own exactly-once application.
 */
public class TreeTransformer {

	private static final Logger logger = LoggerFactory.getLogger(TreeTransformer.class);

	private final ModifierTable modifiers;
	private final Set<String> ignoreBlocks;

	public TreeTransformer(ModifierTable modifiers, Collection<String> ignoreBlocks) {
		this.modifiers = Objects.requireNonNull(modifiers, "modifiers must not be null");
		this.ignoreBlocks = Set.copyOf(ignoreBlocks);
	}

	/**
	 * Transforms every top-level expression of a regular file.
	 *
	 * @param origin name of the file, used in diagnostics
	 * @return true if at least one value was multiplied
	 */
	public boolean transform(List<PdxExpression> tree, String origin) {
		boolean changed = false;
		Deque<String> path = new ArrayDeque<>();
		for (PdxExpression expression : tree) {
			changed = process(expression, path, origin) || changed;
		}
		return changed;
	}

	/**
	 * Transforms a static modifier file: every top-level value must be a block, and the
	 * entries of blocks whose key is in {@code ignoredKeys} are left untouched.
	 *
	 * @throws org.javai.pdx.script.PdxSchemaException if a top-level value is not a block
	 */
	public boolean transformStatic(List<PdxExpression> tree, Set<String> ignoredKeys, String origin) {
		boolean changed = false;
		Deque<String> path = new ArrayDeque<>();
		for (PdxExpression group : tree) {
			PdxBlock body = group.requireBlock(origin);
			if (ignoredKeys.contains(group.key())) {
				logger.debug("Skipping static group '{}' in {}", group.key(), origin);
				continue;
			}
			path.addLast(group.key());
			for (PdxExpression entry : body.entries()) {
				changed = process(entry, path, origin) || changed;
			}
			path.removeLast();
		}
		return changed;
	}

	private boolean process(PdxExpression expression, Deque<String> path, String origin) {
		if (ignoreBlocks.contains(expression.key())) {
			return false;
		}
		PdxValue rhs = expression.rhs();
		if (rhs instanceof PdxBlock block) {
			boolean changed = false;
			path.addLast(expression.key());
			for (PdxExpression child : block.entries()) {
				changed = process(child, path, origin) || changed;
			}
			path.removeLast();
			return changed;
		}
		Optional<BigDecimal> multiplier = modifiers.multiplierFor(expression.key());
		if (multiplier.isEmpty()) {
			return false;
		}
		if (!(rhs instanceof PdxNumber number)) {
			// modifier names are reused for unrelated data, e.g. merchants = yes
			logger.warn("  Modifier '{}' has non-numeric value {} at {} > {}",
					expression.key(), PdxPrinter.print(rhs), origin, describe(path, expression.key()));
			return false;
		}
		number.multiply(multiplier.get());
		return true;
	}

	private static String describe(Deque<String> path, String key) {
		if (path.isEmpty()) {
			return key;
		}
		return String.join(" > ", path) + " > " + key;
	}
}

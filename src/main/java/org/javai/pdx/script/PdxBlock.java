package org.javai.pdx.script;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered sequence of expressions between braces.
 *
 * A block owns its entries. The same expression instance may appear only once, and
 * programmatic callers must not share an expression between blocks: {@link PdxNumber}
 * is mutable, so a shared number would be multiplied once per occurrence.
 */
public record PdxBlock(List<PdxExpression> entries) implements PdxValue {

	public PdxBlock {
		entries = entries != null ? List.copyOf(entries) : List.of();
		Set<PdxExpression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (PdxExpression entry : entries) {
			if (!seen.add(entry)) {
				throw new IllegalArgumentException("Expression '" + entry.key() + "' appears twice in the same block");
			}
		}
	}

	public static PdxBlock of(PdxExpression... entries) {
		return new PdxBlock(List.of(entries));
	}

	/**
	 * First entry whose key equals {@code key}, if any.
	 */
	public Optional<PdxExpression> find(String key) {
		return entries.stream().filter(e -> e.key().equals(key)).findFirst();
	}

	@Override
	public Kind kind() {
		return Kind.BLOCK;
	}
}

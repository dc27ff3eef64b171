package org.javai.pdx.config;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Settings of the {@code multiply} section, with built-in defaults already applied.
 */
public record MultiplySettings(
	Path destination,
	List<Path> targets,
	Set<String> ignoreStatic,
	Set<String> ignoreBlocks,
	Set<String> ignoreDirs,
	String rootDirectory,
	String staticDirectory,
	Charset encoding,
	boolean continueOnError
) {
}

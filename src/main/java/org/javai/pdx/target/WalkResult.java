package org.javai.pdx.target;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of walking one target directory.
 *
 * @param filesProcessed files that were parsed and transformed
 * @param written destination files that were written
 * @param failed source files skipped because of an error (only with continue-on-error)
 */
public record WalkResult(int filesProcessed, List<Path> written, List<Path> failed) {

	public WalkResult {
		written = List.copyOf(written);
		failed = List.copyOf(failed);
	}

	public boolean hasFailures() {
		return !failed.isEmpty();
	}

	public WalkResult plus(WalkResult other) {
		List<Path> allWritten = new ArrayList<>(written);
		allWritten.addAll(other.written);
		List<Path> allFailed = new ArrayList<>(failed);
		allFailed.addAll(other.failed);
		return new WalkResult(filesProcessed + other.filesProcessed, allWritten, allFailed);
	}
}

package tuff.porter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link ProjectTranspiler#transpileTree}: the .tuff files written, and the
 * .java files skipped with the reason for each.
 */
public record TranspileReport(List<Path> written, Map<Path, TranspileFailure> failed) {
	public boolean isClean() {
		return failed.isEmpty();
	}
}

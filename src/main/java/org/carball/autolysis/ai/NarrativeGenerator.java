package org.carball.autolysis.ai;

import org.carball.autolysis.model.report.ProfileReport;

import java.nio.file.Path;
import java.util.Map;

/**
 * Produces a readable story about a profiling run. Implementations never throw for service
 * failures; they fall back to a narrative derived from the report itself.
 */
public interface NarrativeGenerator {

    /**
     * @param report the profiling result
     * @param charts chart name to written image path, possibly empty
     */
    String generateNarrative(ProfileReport report, Map<String, Path> charts);
}

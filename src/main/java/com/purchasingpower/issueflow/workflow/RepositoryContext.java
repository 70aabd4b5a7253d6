package com.purchasingpower.issueflow.workflow;

import java.util.List;

/**
 * What the planner and the code generator see of the repository.
 *
 * @param structure     nested JSON tree of the working copy
 * @param relevantFiles JSON array of {@code {path, content}} for the selected files, or the
 *                      structure again when none of them could be read
 * @param selectedPaths the paths that were picked, for logging
 */
public record RepositoryContext(String structure, String relevantFiles, List<String> selectedPaths) {
}

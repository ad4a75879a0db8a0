package com.raditha.cppnorm.output;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.List;

/**
 * Unified diff between the token listing of a file before and after normalization.
 * Uses java-diff-utils.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT = 3;

    /**
     * @param fileName  name shown in the {@code ---}/{@code +++} header
     * @param original  lines of the plain token listing
     * @param revised   lines of the normalized token listing
     * @return the unified diff, empty when the listings are equal
     */
    public String generateUnifiedDiff(String fileName, List<String> original, List<String> revised) {
        return generateUnifiedDiff(fileName, original, revised, DEFAULT_CONTEXT);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, List<String> original, List<String> revised,
            int contextLines) {
        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                original,
                patch,
                contextLines);
        return String.join("\n", unifiedDiff);
    }
}

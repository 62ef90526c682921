package io.netconf.confdiff.report;

import io.netconf.confdiff.compare.ChildrenDiff;
import io.netconf.confdiff.compare.ComparisonResult;
import io.netconf.confdiff.compare.LinePair;
import io.netconf.confdiff.tree.ConfLine;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/**
 * Renders a {@link ComparisonResult} as a line-oriented text report.
 *
 * <p>Modified root lines are followed by a unified diff of both subtrees so that changes hidden below a
 * modified root remain visible. The ignore pattern only decides which root lines are compared, so these
 * diffs show every line below the root.
 */
public class ComparisonReportRenderer {

    static final String NO_DIFFERENCES = "No differences.";
    static final String MODIFIED_ROOTS_HEADER = "Modified root lines (subtree diffs are not filtered by the ignore pattern):";
    static final int DEFAULT_CONTEXT_LINES = 3;
    private static final String INDENT = "  ";

    private final int contextLines;

    public ComparisonReportRenderer() {
        this(DEFAULT_CONTEXT_LINES);
    }

    public ComparisonReportRenderer(int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be zero or greater");
        }
        this.contextLines = contextLines;
    }

    public String render(ComparisonResult result) {
        Objects.requireNonNull(result, "result");
        if (!result.hasDifferences()) {
            return NO_DIFFERENCES + System.lineSeparator();
        }

        List<String> out = new ArrayList<>();
        if (!result.deletedRoots().isEmpty()) {
            out.add("Deleted root lines:");
            result.deletedRoots().forEach(root -> appendSubtree(out, "- ", root));
        }
        if (!result.addedRoots().isEmpty()) {
            out.add("Added root lines:");
            result.addedRoots().forEach(root -> appendSubtree(out, "+ ", root));
        }
        if (!result.modifiedRoots().isEmpty()) {
            out.add(MODIFIED_ROOTS_HEADER);
            for (LinePair pair : result.modifiedRoots()) {
                out.add("~ " + pair.reference().text() + " => " + pair.compared().text());
                out.addAll(unifiedDiff(pair.reference(), pair.compared()));
            }
        }
        for (ChildrenDiff entry : result.modifiedChildren()) {
            out.add("Changes under: " + entry.parent().path());
            entry.deletedChildren().forEach(child -> appendSubtree(out, INDENT + "- ", child));
            entry.addedChildren().forEach(child -> appendSubtree(out, INDENT + "+ ", child));
            for (LinePair pair : entry.modifiedChildren()) {
                out.add(INDENT + "~ " + pair.reference().text() + " => " + pair.compared().text());
            }
        }
        out.add(summary(result));
        return String.join(System.lineSeparator(), out) + System.lineSeparator();
    }

    String summary(ComparisonResult result) {
        return String.format("Summary: %d deleted, %d added, %d modified root line(s), %d parent(s) with changed children",
                result.deletedRoots().size(),
                result.addedRoots().size(),
                result.modifiedRoots().size(),
                result.modifiedChildren().size());
    }

    private void appendSubtree(List<String> out, String marker, ConfLine top) {
        for (ConfLine line : top.subtree()) {
            out.add(marker + relativeIndent(top, line) + line.text());
        }
    }

    private List<String> unifiedDiff(ConfLine reference, ConfLine compared) {
        RawText referenceText = new RawText(toBytes(reference));
        RawText comparedText = new RawText(toBytes(compared));
        DiffAlgorithm algorithm = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM);
        EditList edits = algorithm.diff(RawTextComparator.DEFAULT, referenceText, comparedText);

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(buffer)) {
            formatter.setContext(contextLines);
            formatter.format(edits, referenceText, comparedText);
            formatter.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to format subtree diff for " + reference.text(), ex);
        }
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private byte[] toBytes(ConfLine top) {
        StringBuilder builder = new StringBuilder();
        for (ConfLine line : top.subtree()) {
            builder.append(relativeIndent(top, line)).append(line.text()).append('\n');
        }
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String relativeIndent(ConfLine top, ConfLine line) {
        return INDENT.repeat(Math.max(0, line.level() - top.level()));
    }
}

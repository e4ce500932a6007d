package org.modfix;

import java.util.List;
import java.util.Set;
import org.eclipse.lsp4j.Diagnostic;

/** A fix for one kind of diagnostic. Fixes never modify their input; they return a new document. */
public interface CodeFix {
    Set<String> fixableDiagnosticIds();

    String title();

    String fixAllTitle();

    /** True if {@code diagnostic} is one of ours and the code it points at can be fixed */
    boolean canFix(Document document, Diagnostic diagnostic);

    /** Returns {@code document} itself if there is nothing to fix */
    Document computeFix(Document document, Diagnostic diagnostic);

    /** Fixes every site in one pass. Returns {@code document} itself if there is nothing to fix. */
    Document computeBatchFix(Document document, List<Diagnostic> diagnostics);

    default boolean accepts(Diagnostic diagnostic) {
        var code = diagnostic.getCode();
        return code != null && code.isLeft() && fixableDiagnosticIds().contains(code.getLeft());
    }
}

package org.modfix;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Diagnostic;
import org.modfix.rewrite.BatchFixer;
import org.modfix.rewrite.EditDescriptor;
import org.modfix.rewrite.RemoveModifier;
import org.modfix.syntax.TokenKind;

/** Removes a `new` modifier that doesn't hide anything. */
public class RemoveNewModifierFix implements CodeFix {
    /** The member does not hide an accessible member, so `new` is not required */
    public static final String DIAGNOSTIC_CODE = "compiler.warn.new.not.required";

    private final RemoveModifier removeNew = new RemoveModifier(TokenKind.NEW);

    @Override
    public Set<String> fixableDiagnosticIds() {
        return Set.of(DIAGNOSTIC_CODE);
    }

    @Override
    public String title() {
        return "Remove 'new' modifier";
    }

    @Override
    public String fixAllTitle() {
        return "Remove all redundant 'new' modifiers";
    }

    Optional<EditDescriptor> site(Document document, Diagnostic diagnostic) {
        if (!accepts(diagnostic) || diagnostic.getRange() == null) return Optional.empty();
        var start = diagnostic.getRange().getStart();
        var offset = document.text().offsetOf(start.getLine(), start.getCharacter());
        return removeNew.locate(document.root(), offset);
    }

    @Override
    public boolean canFix(Document document, Diagnostic diagnostic) {
        return site(document, diagnostic).isPresent();
    }

    @Override
    public Document computeFix(Document document, Diagnostic diagnostic) {
        var site = site(document, diagnostic);
        if (!site.isPresent()) {
            LOG.fine(String.format("Nothing to fix for %s in %s", diagnostic.getRange(), document));
            return document;
        }
        var fixed = removeNew.apply(document.root(), document.text(), site.get());
        return document.withSyntaxRoot(fixed);
    }

    @Override
    public Document computeBatchFix(Document document, List<Diagnostic> diagnostics) {
        var sites = new ArrayList<EditDescriptor>();
        for (var d : diagnostics) {
            site(document, d).ifPresent(sites::add);
        }
        if (sites.isEmpty()) return document;
        LOG.info(String.format("Removing %d `new` modifiers from %s", sites.size(), document));
        var fixed = new BatchFixer(removeNew).apply(document.root(), document.text(), sites);
        return document.withSyntaxRoot(fixed);
    }

    private static final Logger LOG = Logger.getLogger("main");
}

package org.modfix;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

class CodeActions {
    private final CodeFix fix;
    private final FixSettings settings;

    CodeActions(CodeFix fix, FixSettings settings) {
        this.fix = fix;
        this.settings = settings;
    }

    /** One quick fix per fixable diagnostic, plus a fix-all action if more than one can be fixed */
    List<Either<Command, CodeAction>> find(Document document, List<Diagnostic> diagnostics, CancelChecker cancel) {
        var actions = new ArrayList<Either<Command, CodeAction>>();
        var fixable = new ArrayList<Diagnostic>();
        for (var d : diagnostics) {
            cancel.checkCanceled();
            if (!fix.canFix(document, d)) continue;
            fixable.add(d);
            var fixed = fix.computeFix(document, d);
            quickFix(fix.title(), document, fixed, List.of(d)).ifPresent(a -> actions.add(Either.forRight(a)));
        }
        if (fixable.size() > 1 && settings.modfix.offerFixAll) {
            cancel.checkCanceled();
            var fixed = fix.computeBatchFix(document, fixable);
            quickFix(fix.fixAllTitle(), document, fixed, fixable).ifPresent(a -> actions.add(Either.forRight(a)));
        }
        LOG.fine(String.format("Found %d code actions for %d diagnostics", actions.size(), diagnostics.size()));
        return actions;
    }

    private Optional<CodeAction> quickFix(String title, Document before, Document after, List<Diagnostic> diagnostics) {
        var edit = EditHelper.replaceChanged(before, after);
        if (!edit.isPresent()) return Optional.empty();
        var action = new CodeAction(title);
        action.setKind(CodeActionKind.QuickFix);
        action.setDiagnostics(diagnostics);
        action.setIsPreferred(diagnostics.size() == 1);
        action.setEdit(new WorkspaceEdit(Map.of(before.uri.toString(), List.of(edit.get()))));
        return Optional.of(action);
    }

    private static final Logger LOG = Logger.getLogger("main");
}

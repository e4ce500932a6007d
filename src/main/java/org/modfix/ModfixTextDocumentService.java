package org.modfix;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.jsonrpc.CompletableFutures;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.modfix.syntax.SourceText;

class ModfixTextDocumentService implements TextDocumentService {
    private final ModfixLanguageServer server;
    private final Map<URI, Document> activeDocuments = new ConcurrentHashMap<>();

    ModfixTextDocumentService(ModfixLanguageServer server) {
        this.server = server;
    }

    @Override
    public CompletableFuture<List<Either<Command, CodeAction>>> codeAction(CodeActionParams params) {
        return CompletableFutures.computeAsync(
                cancel -> {
                    var uri = URI.create(params.getTextDocument().getUri());
                    var document = activeDocuments.get(uri);
                    if (document == null) {
                        LOG.warning("Code actions requested for " + uri + ", which is not open");
                        return List.<Either<Command, CodeAction>>of();
                    }
                    cancel.checkCanceled();
                    return server.codeActions().find(document, params.getContext().getDiagnostics(), cancel);
                });
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        var document = params.getTextDocument();
        var uri = URI.create(document.getUri());
        activeDocuments.put(uri, new Document(uri, document.getText(), document.getVersion()));
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        var document = params.getTextDocument();
        var uri = URI.create(document.getUri());
        var existing = activeDocuments.get(uri);
        if (existing == null) {
            LOG.warning("Ignored change to " + uri + ", which is not open");
            return;
        }
        if (document.getVersion() <= existing.version) {
            LOG.warning("Ignored change with version " + document.getVersion() + " <= " + existing.version);
            return;
        }
        var newText = existing.content();
        for (var change : params.getContentChanges()) {
            if (change.getRange() == null) newText = change.getText();
            else newText = patch(newText, change);
        }
        activeDocuments.put(uri, existing.withContent(newText, document.getVersion()));
    }

    private static String patch(String sourceText, TextDocumentContentChangeEvent change) {
        var text = SourceText.of(sourceText);
        var range = change.getRange();
        var start = EditHelper.offset(text, range.getStart());
        var end = EditHelper.offset(text, range.getEnd());
        return sourceText.substring(0, start) + change.getText() + sourceText.substring(Math.max(start, end));
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        var uri = URI.create(params.getTextDocument().getUri());
        activeDocuments.remove(uri);
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        LOG.fine("Saved " + params.getTextDocument().getUri());
    }

    Optional<Document> document(URI uri) {
        return Optional.ofNullable(activeDocuments.get(uri));
    }

    private static final Logger LOG = Logger.getLogger("main");
}

package org.modfix;

import com.google.gson.JsonParseException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.CodeActionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;

class ModfixLanguageServer implements LanguageServer, LanguageClientAware {
    private final ModfixTextDocumentService textDocuments = new ModfixTextDocumentService(this);
    private final ModfixWorkspaceService workspace = new ModfixWorkspaceService(this);
    private final CodeFix fix = new RemoveNewModifierFix();
    private final Runnable onExit;
    private volatile FixSettings settings = new FixSettings();
    private volatile LanguageClient client;

    ModfixLanguageServer(Runnable onExit) {
        this.onExit = onExit;
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        updateSettings(params.getInitializationOptions());

        var capabilities = new ServerCapabilities();
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        capabilities.setCodeActionProvider(new CodeActionOptions(List.of(CodeActionKind.QuickFix)));
        LOG.info("Initialized");
        return CompletableFuture.completedFuture(new InitializeResult(capabilities));
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        LOG.info("Shutdown");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        LOG.info("Exit");
        onExit.run();
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return textDocuments;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspace;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
    }

    FixSettings settings() {
        return settings;
    }

    /** Replaces the current settings; settings that can't be read are ignored */
    void updateSettings(Object json) {
        if (json == null) return;
        FixSettings next;
        try {
            next = JsonHelper.settings(json);
        } catch (JsonParseException e) {
            LOG.log(Level.WARNING, "Ignored settings " + json, e);
            if (client != null) {
                client.showMessage(new MessageParams(MessageType.Warning, "Ignored invalid settings: " + e.getMessage()));
            }
            return;
        }
        try {
            Logger.getLogger("main").setLevel(Level.parse(next.modfix.logLevel));
        } catch (IllegalArgumentException e) {
            LOG.warning("Unknown log level " + next.modfix.logLevel);
        }
        settings = next;
        LOG.info("Settings are now\n" + JsonHelper.GSON.toJson(next));
    }

    CodeActions codeActions() {
        return new CodeActions(fix, settings);
    }

    private static final Logger LOG = Logger.getLogger("main");
}

package org.modfix;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;
import static org.modfix.Diagnostics.*;

import com.google.gson.JsonParser;
import java.net.URI;
import java.util.List;
import org.eclipse.lsp4j.CodeActionContext;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.junit.Before;
import org.junit.Test;

public class ModfixTextDocumentServiceTest {
    static final URI FILE = URI.create("file:///workspace/Example.cs");
    static final String TEXT = "class C : B {\n    new void M() { }\n}\n";

    static {
        Main.setRootFormat();
    }

    ModfixLanguageServer server;
    ModfixTextDocumentService documents;

    @Before
    public void open() {
        server = new ModfixLanguageServer(() -> {});
        server.initialize(new InitializeParams()).join();
        documents = (ModfixTextDocumentService) server.getTextDocumentService();
        documents.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(FILE.toString(), "csharp", 1, TEXT)));
    }

    private void change(int version, TextDocumentContentChangeEvent change) {
        var id = new VersionedTextDocumentIdentifier(FILE.toString(), version);
        documents.didChange(new DidChangeTextDocumentParams(id, List.of(change)));
    }

    private String content() {
        return documents.document(FILE).get().content();
    }

    @Test
    public void capabilities() {
        var result = server.initialize(new InitializeParams()).join();
        assertThat(result.getCapabilities().getTextDocumentSync().getLeft(), equalTo(TextDocumentSyncKind.Incremental));
        assertThat(result.getCapabilities().getCodeActionProvider().isRight(), equalTo(true));
    }

    @Test
    public void codeAction() {
        var context = new CodeActionContext(List.of(newNotRequired(1, 13)));
        var params =
                new CodeActionParams(
                        new TextDocumentIdentifier(FILE.toString()),
                        new Range(new Position(1, 13), new Position(1, 13)),
                        context);
        var actions = documents.codeAction(params).join();
        assertThat(actions, hasSize(1));
        assertThat(actions.get(0).getRight().getTitle(), equalTo("Remove 'new' modifier"));
    }

    @Test
    public void codeActionForClosedFile() {
        documents.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(FILE.toString())));
        var context = new CodeActionContext(List.of(newNotRequired(1, 13)));
        var params =
                new CodeActionParams(
                        new TextDocumentIdentifier(FILE.toString()),
                        new Range(new Position(1, 13), new Position(1, 13)),
                        context);
        assertThat(documents.codeAction(params).join(), empty());
    }

    @Test
    public void incrementalChange() {
        var insert = new TextDocumentContentChangeEvent(new Range(new Position(1, 4), new Position(1, 4)), "public ");
        change(2, insert);
        assertThat(content(), equalTo("class C : B {\n    public new void M() { }\n}\n"));
        assertThat(documents.document(FILE).get().version, equalTo(2));

        var delete = new TextDocumentContentChangeEvent(new Range(new Position(1, 11), new Position(1, 15)), "");
        change(3, delete);
        assertThat(content(), equalTo("class C : B {\n    public void M() { }\n}\n"));
    }

    @Test
    public void fullChange() {
        change(2, new TextDocumentContentChangeEvent("int x;"));
        assertThat(content(), equalTo("int x;"));
    }

    @Test
    public void staleChangeIsIgnored() {
        change(1, new TextDocumentContentChangeEvent("int x;"));
        assertThat(content(), equalTo(TEXT));
    }

    @Test
    public void settings() {
        var json = JsonParser.parseString("{\"modfix\": {\"offerFixAll\": false, \"logLevel\": \"FINE\"}}");
        server.getWorkspaceService().didChangeConfiguration(new DidChangeConfigurationParams(json));
        assertThat(server.settings().modfix.offerFixAll, equalTo(false));
        assertThat(server.settings().modfix.logLevel, equalTo("FINE"));
    }

    @Test
    public void invalidSettingsAreIgnored() {
        var json = JsonParser.parseString("{\"modfix\": {\"offerFixAll\": {\"nested\": 1}}}");
        server.getWorkspaceService().didChangeConfiguration(new DidChangeConfigurationParams(json));
        assertThat(server.settings().modfix.offerFixAll, equalTo(true));
    }

    @Test
    public void nullLogLevelKeepsDefault() {
        var json = JsonParser.parseString("{\"modfix\": {\"offerFixAll\": false, \"logLevel\": null}}");
        server.getWorkspaceService().didChangeConfiguration(new DidChangeConfigurationParams(json));
        assertThat(server.settings().modfix.offerFixAll, equalTo(false));
        assertThat(server.settings().modfix.logLevel, equalTo("INFO"));
    }
}

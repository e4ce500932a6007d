package org.modfix;

import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;

public class Main {
    private static final Logger LOG = Logger.getLogger("main");

    public static void setRootFormat() {
        var root = Logger.getLogger("");

        for (var h : root.getHandlers()) h.setFormatter(new LogFormat());
    }

    public static void main(String[] args) {
        try {
            setRootFormat();

            if (args.length == 3 && args[0].equals("--fix")) {
                System.out.print(fixFile(Paths.get(args[1]), Paths.get(args[2])));
                return;
            }

            var server = new ModfixLanguageServer(() -> System.exit(0));
            var threads = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "client"));
            var launcher =
                    new LSPLauncher.Builder<LanguageClient>()
                            .setLocalService(server)
                            .setRemoteInterface(LanguageClient.class)
                            .setInput(System.in)
                            .setOutput(System.out)
                            .setExecutorService(threads)
                            .create();

            server.connect(launcher.getRemoteProxy());
            launcher.startListening();
            LOG.info(String.format("java.version is %s", System.getProperty("java.version")));
        } catch (Throwable t) {
            LOG.log(Level.SEVERE, t.getMessage(), t);

            System.exit(1);
        }
    }

    /** A diagnostic position as it appears in the sites file of {@code --fix} */
    static class Site {
        int line, character;
    }

    /**
     * Removes the redundant `new` modifiers at {@code sitesFile}, a JSON array of zero-based {@code {"line": L,
     * "character": C}} positions, and returns the fixed text of {@code sourceFile}.
     */
    static String fixFile(Path sourceFile, Path sitesFile) {
        String content, sitesJson;
        try {
            content = Files.readString(sourceFile, StandardCharsets.UTF_8);
            sitesJson = Files.readString(sitesFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        List<Site> sites = JsonHelper.GSON.fromJson(sitesJson, new TypeToken<List<Site>>() {}.getType());
        var diagnostics = new ArrayList<Diagnostic>();
        for (var s : sites) {
            var at = new Position(s.line, s.character);
            var d = new Diagnostic(new Range(at, at), "'new' is not required");
            d.setCode(RemoveNewModifierFix.DIAGNOSTIC_CODE);
            diagnostics.add(d);
        }
        var document = new Document(sourceFile.toUri(), content, 0);
        var fixed = new RemoveNewModifierFix().computeBatchFix(document, diagnostics);
        LOG.info(String.format("Fixed %d sites in %s", diagnostics.size(), sourceFile));
        return fixed.content();
    }
}

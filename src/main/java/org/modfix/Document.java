package org.modfix;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.net.URI;
import org.modfix.syntax.Parser;
import org.modfix.syntax.SourceText;
import org.modfix.syntax.SyntaxNode;

/** The text of one version of a file and its syntax tree, which is parsed the first time someone asks for it. */
public class Document {
    public final URI uri;
    public final int version;
    private final SourceText text;
    private final Supplier<SyntaxNode> root;

    public Document(URI uri, String content, int version) {
        this.uri = checkNotNull(uri);
        this.version = version;
        this.text = SourceText.of(content);
        this.root = Suppliers.memoize(() -> Parser.parse(text));
    }

    private Document(URI uri, int version, SyntaxNode root) {
        this.uri = uri;
        this.version = version;
        this.text = SourceText.of(root.toFullString());
        this.root = Suppliers.ofInstance(root);
    }

    public SourceText text() {
        return text;
    }

    public String content() {
        return text.toString();
    }

    public SyntaxNode root() {
        return root.get();
    }

    /** A document with the same identity whose text is printed from {@code newRoot} */
    public Document withSyntaxRoot(SyntaxNode newRoot) {
        if (newRoot == root()) return this;
        return new Document(uri, version, newRoot);
    }

    public Document withContent(String content, int version) {
        return new Document(uri, content, version);
    }

    @Override
    public String toString() {
        return uri + "@" + version;
    }
}

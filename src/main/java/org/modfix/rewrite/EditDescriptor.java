package org.modfix.rewrite;

import static com.google.common.base.Preconditions.checkArgument;

import org.modfix.syntax.SyntaxPath;

/** A modifier to remove and the declaration that holds it, both located in the same original tree. */
public final class EditDescriptor {
    public final SyntaxPath targetToken, declaration;

    public EditDescriptor(SyntaxPath targetToken, SyntaxPath declaration) {
        checkArgument(targetToken.isToken(), "%s is not a token", targetToken);
        checkArgument(!declaration.isToken() && declaration.node().kind.isDeclaration(), "%s is not a declaration", declaration);
        checkArgument(targetToken.root().leaf() == declaration.root().leaf(), "Token and declaration are in different trees");
        this.targetToken = targetToken;
        this.declaration = declaration;
    }

    @Override
    public String toString() {
        return "remove " + targetToken + " from " + declaration;
    }
}

package org.modfix;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/** Diagnostics like a compiler would report them */
class Diagnostics {
    static Diagnostic newNotRequired(int line, int character) {
        return withCode(RemoveNewModifierFix.DIAGNOSTIC_CODE, line, character);
    }

    static Diagnostic withCode(String code, int line, int character) {
        var at = new Position(line, character);
        var d = new Diagnostic(new Range(at, at), "The member does not hide an accessible member", DiagnosticSeverity.Warning, "test");
        d.setCode(code);
        return d;
    }
}

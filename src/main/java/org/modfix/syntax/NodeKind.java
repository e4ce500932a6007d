package org.modfix.syntax;

public enum NodeKind {
    COMPILATION_UNIT,
    NAMESPACE_DECLARATION,
    TYPE_DECLARATION,
    METHOD_DECLARATION,
    PROPERTY_DECLARATION,
    FIELD_DECLARATION,
    /** {@code [Attribute, ...]} in front of a declaration */
    ATTRIBUTE_LIST,
    MODIFIER_LIST,
    TYPE,
    PARAMETER_LIST,
    TYPE_PARAMETER_LIST,
    BLOCK,
    INITIALIZER,
    /** Tokens the parser could not make sense of */
    SKIPPED;

    /** Declarations carry a MODIFIER_LIST, after their ATTRIBUTE_LISTs if they have any */
    public boolean isDeclaration() {
        switch (this) {
            case TYPE_DECLARATION:
            case METHOD_DECLARATION:
            case PROPERTY_DECLARATION:
            case FIELD_DECLARATION:
                return true;
            default:
                return false;
        }
    }
}

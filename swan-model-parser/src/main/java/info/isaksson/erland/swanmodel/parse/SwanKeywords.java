package info.isaksson.erland.swanmodel.parse;

import java.util.Set;

/** Reserved words of the language; none of them can be used as an identifier. */
final class SwanKeywords {

    static final Set<String> RESERVED = Set.of(
            "activate", "and", "as", "assume", "automaton", "block", "bool", "bypos", "byname",
            "case", "char", "clock", "const", "def", "default", "diagram", "elsif", "else", "emit",
            "end", "enum", "every", "expr", "false", "flatten", "float", "float32", "float64", "fold",
            "foldi", "forward", "function", "group", "guarantee", "if", "initial", "inline", "int8",
            "int16", "int32", "int64", "integer", "land", "last", "let", "lnot", "lor", "lsl", "lsr",
            "lxor", "map", "mapfold", "mapfoldi", "mapi", "match", "merge", "mod", "node", "not",
            "numeric", "of", "or", "pack", "pre", "probe", "restart", "resume", "returns", "reverse",
            "self", "sensor", "signed", "specialize", "state", "then", "transpose", "true", "type",
            "uint8", "uint16", "uint32", "uint64", "unless", "unsigned", "until", "use", "var",
            "when", "where", "window", "wire", "with", "xor");

    /** Keywords opening a scope section. */
    static final Set<String> SECTIONS = Set.of("var", "let", "emit", "assume", "guarantee", "diagram");

    /** Keywords opening a global declaration. */
    static final Set<String> DECLARATIONS = Set.of(
            "type", "const", "sensor", "group", "use", "function", "node", "inline");

    private SwanKeywords() {
    }

    static boolean isReserved(String word) {
        return RESERVED.contains(word);
    }
}

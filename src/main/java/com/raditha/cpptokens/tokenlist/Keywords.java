package com.raditha.cpptokens.tokenlist;

import com.raditha.cpptokens.config.Standards.CStandard;
import com.raditha.cpptokens.config.Standards.CppStandard;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keyword tables for each C and C++ standard.
 */
public final class Keywords {

    private static final Set<String> C89 = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else",
            "enum", "extern", "float", "for", "goto", "if", "int", "long", "register", "return",
            "short", "signed", "sizeof", "static", "struct", "switch", "typedef", "union",
            "unsigned", "void", "volatile", "while");
    private static final Set<String> C99 = Set.of(
            "inline", "restrict", "_Bool", "_Complex", "_Imaginary");
    private static final Set<String> C11 = Set.of(
            "_Alignas", "_Alignof", "_Atomic", "_Generic", "_Noreturn", "_Static_assert", "_Thread_local");
    private static final Set<String> C23 = Set.of(
            "alignas", "alignof", "bool", "constexpr", "false", "nullptr", "static_assert",
            "thread_local", "true", "typeof", "typeof_unqual", "_BitInt", "_Decimal128",
            "_Decimal32", "_Decimal64");

    private static final Set<String> CPP03 = Set.of(
            "asm", "auto", "bool", "break", "case", "catch", "char", "class", "const", "const_cast",
            "continue", "default", "delete", "do", "double", "dynamic_cast", "else", "enum",
            "explicit", "export", "extern", "false", "float", "for", "friend", "goto", "if",
            "inline", "int", "long", "mutable", "namespace", "new", "operator", "private",
            "protected", "public", "register", "reinterpret_cast", "return", "short", "signed",
            "sizeof", "static", "static_cast", "struct", "switch", "template", "this", "throw",
            "true", "try", "typedef", "typeid", "typename", "union", "unsigned", "using",
            "virtual", "void", "volatile", "wchar_t", "while");
    private static final Set<String> CPP11 = Set.of(
            "alignas", "alignof", "char16_t", "char32_t", "constexpr", "decltype", "noexcept",
            "nullptr", "static_assert", "thread_local");
    private static final Set<String> CPP20 = Set.of(
            "char8_t", "concept", "consteval", "constinit", "co_await", "co_return", "co_yield",
            "requires");

    private static final Map<CStandard, Set<String>> C_KEYWORDS = new EnumMap<>(CStandard.class);
    private static final Map<CppStandard, Set<String>> CPP_KEYWORDS = new EnumMap<>(CppStandard.class);

    static {
        for (CStandard std : CStandard.values()) {
            Set<String> all = new HashSet<>(C89);
            if (std.compareTo(CStandard.C99) >= 0) {
                all.addAll(C99);
            }
            if (std.compareTo(CStandard.C11) >= 0) {
                all.addAll(C11);
            }
            if (std.compareTo(CStandard.C23) >= 0) {
                all.addAll(C23);
            }
            C_KEYWORDS.put(std, Set.copyOf(all));
        }
        for (CppStandard std : CppStandard.values()) {
            Set<String> all = new HashSet<>(CPP03);
            if (std.atLeast(CppStandard.CPP11)) {
                all.addAll(CPP11);
            }
            if (std.atLeast(CppStandard.CPP20)) {
                all.addAll(CPP20);
            }
            CPP_KEYWORDS.put(std, Set.copyOf(all));
        }
    }

    private Keywords() {
    }

    public static Set<String> getAll(CStandard standard) {
        return C_KEYWORDS.get(standard);
    }

    public static Set<String> getAll(CppStandard standard) {
        return CPP_KEYWORDS.get(standard);
    }
}

package com.raditha.cpptokens.config;

import java.util.Locale;

/**
 * Configured language standards for C and C++ sources.
 *
 * @param c   C standard used for C translation units
 * @param cpp C++ standard used for C++ translation units
 */
public record Standards(CStandard c, CppStandard cpp) {

    public Standards {
        if (c == null) {
            throw new IllegalArgumentException("c standard cannot be null");
        }
        if (cpp == null) {
            throw new IllegalArgumentException("cpp standard cannot be null");
        }
    }

    /**
     * C11 and C++17.
     */
    public static Standards defaults() {
        return new Standards(CStandard.C11, CppStandard.CPP17);
    }

    public enum CStandard {
        C89, C99, C11, C17, C23;

        /**
         * Parse names such as {@code c99}, {@code C11} or {@code gnu17}.
         */
        public static CStandard fromString(String value) {
            String v = value.trim().toLowerCase(Locale.ROOT).replace("gnu", "c");
            return switch (v) {
                case "c89", "c90", "ansi" -> C89;
                case "c99" -> C99;
                case "c11" -> C11;
                case "c17", "c18" -> C17;
                case "c23", "c2x" -> C23;
                default -> throw new IllegalArgumentException("Unknown C standard: " + value);
            };
        }
    }

    public enum CppStandard {
        CPP03, CPP11, CPP14, CPP17, CPP20, CPP23, CPP26;

        /**
         * Parse names such as {@code c++11}, {@code cpp20} or {@code gnu++17}.
         */
        public static CppStandard fromString(String value) {
            String v = value.trim().toLowerCase(Locale.ROOT)
                    .replace("gnu++", "c++")
                    .replace("cpp", "c++");
            return switch (v) {
                case "c++98", "c++03" -> CPP03;
                case "c++11", "c++0x" -> CPP11;
                case "c++14", "c++1y" -> CPP14;
                case "c++17", "c++1z" -> CPP17;
                case "c++20", "c++2a" -> CPP20;
                case "c++23", "c++2b" -> CPP23;
                case "c++26", "c++2c" -> CPP26;
                default -> throw new IllegalArgumentException("Unknown C++ standard: " + value);
            };
        }

        public boolean atLeast(CppStandard other) {
            return compareTo(other) >= 0;
        }
    }
}

package com.raditha.cpptokens.tokenlist;

import com.raditha.cpptokens.config.Language;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * File name helpers: language detection by extension and relative paths.
 */
public final class SourcePaths {

    private static final Set<String> C_EXTENSIONS = Set.of(".c", ".cl");
    private static final Set<String> CPP_EXTENSIONS = Set.of(
            ".cpp", ".cc", ".cxx", ".c++", ".hpp", ".hh", ".hxx", ".h++", ".tpp", ".txx", ".ipp");

    private SourcePaths() {
    }

    /**
     * Language of a source file judged by its extension.
     *
     * @param cppHeaderProbe treat {@code .h} as C++ rather than C
     * @return the language, or {@link Language#NONE} for an unknown extension
     */
    public static Language identify(String path, boolean cppHeaderProbe) {
        String ext = extension(path);
        if (ext.equals(".h")) {
            return cppHeaderProbe ? Language.CPP : Language.C;
        }
        if (C_EXTENSIONS.contains(ext)) {
            return Language.C;
        }
        // .C is C++ by convention, so compare case sensitively first
        if (ext.equals(".C") || CPP_EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT))) {
            return Language.CPP;
        }
        return Language.NONE;
    }

    static String extension(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash) {
            return "";
        }
        return path.substring(dot);
    }

    /**
     * Make {@code path} relative to the first base path that contains it.
     *
     * @return the relative path, or {@code path} unchanged when no base path matches
     */
    public static String relative(String path, List<String> basePaths) {
        String normalized = path.replace('\\', '/');
        for (String base : basePaths) {
            String b = base.replace('\\', '/');
            if (b.isEmpty()) {
                continue;
            }
            if (!b.endsWith("/")) {
                b = b + "/";
            }
            if (normalized.startsWith(b) && normalized.length() > b.length()) {
                return normalized.substring(b.length());
            }
        }
        return path;
    }
}

package com.raditha.cpptokens.tokenlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered, duplicate free list of the files a token list was built from.
 * <p>
 * Tokens refer to their file by index, so entries are never removed or reordered
 * while tokens exist. A second "original" list shadows the current names for inputs
 * whose file names were rewritten before tokenizing.
 */
public class FileRegistry {

    private final List<String> files = new ArrayList<>();
    private final List<String> origFiles = new ArrayList<>();

    /**
     * @return the index of {@code path}, registering it first if it is new
     */
    public int appendIfNew(String path) {
        int index = files.indexOf(path);
        if (index >= 0) {
            return index;
        }
        files.add(path);
        return files.size() - 1;
    }

    public String get(int index) {
        if (index < 0 || index >= files.size()) {
            throw new IndexOutOfBoundsException("No file with index " + index + ", " + files.size() + " registered");
        }
        return files.get(index);
    }

    /**
     * @return the original name of the file, or its current name when no original was recorded
     */
    public String getOriginal(int index) {
        if (index >= 0 && index < origFiles.size()) {
            return origFiles.get(index);
        }
        return get(index);
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public boolean isValidIndex(int index) {
        return index >= 0 && index < files.size();
    }

    public List<String> files() {
        return Collections.unmodifiableList(files);
    }

    public List<String> originalFiles() {
        return Collections.unmodifiableList(origFiles);
    }

    /**
     * Replace the contents with the given file table, keeping it as the original names too.
     */
    void reset(List<String> table) {
        files.clear();
        files.addAll(table);
        origFiles.clear();
        origFiles.addAll(table);
    }

    /**
     * Record the current names as the original names.
     */
    void snapshotOriginals() {
        origFiles.clear();
        origFiles.addAll(files);
    }

    /**
     * Rename every file in place. Indexes are unchanged.
     */
    void rename(UnaryOperator<String> renamer) {
        files.replaceAll(renamer);
    }

    void clear() {
        files.clear();
        origFiles.clear();
    }

    void copyFrom(FileRegistry other) {
        files.clear();
        files.addAll(other.files);
        origFiles.clear();
        origFiles.addAll(other.origFiles);
    }
}

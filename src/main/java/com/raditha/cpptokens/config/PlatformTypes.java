package com.raditha.cpptokens.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Table of platform specific type aliases, keyed by alias name and platform name.
 * <p>
 * The built-in table covers the common Windows SDK aliases. Additional entries
 * can be supplied through configuration.
 */
public final class PlatformTypes {

    private final Map<String, Map<String, PlatformType>> types;

    private PlatformTypes(Map<String, Map<String, PlatformType>> types) {
        this.types = types;
    }

    public static PlatformTypes empty() {
        return new PlatformTypes(Map.of());
    }

    /**
     * Built-in Windows aliases for the win32A, win32W and win64 platforms.
     */
    public static PlatformTypes defaults() {
        Builder b = builder();
        List<String> windows = List.of(Platform.WIN32A, Platform.WIN32W, Platform.WIN64);

        b.add("BOOL", PlatformType.of("int"), windows);
        b.add("INT", PlatformType.of("int"), windows);
        b.add("UINT", PlatformType.unsignedOf("int"), windows);
        b.add("BOOLEAN", PlatformType.unsignedOf("char"), windows);
        b.add("BYTE", PlatformType.unsignedOf("char"), windows);
        b.add("CHAR", PlatformType.of("char"), windows);
        b.add("UCHAR", PlatformType.unsignedOf("char"), windows);
        b.add("SHORT", PlatformType.of("short"), windows);
        b.add("WORD", PlatformType.unsignedOf("short"), windows);
        b.add("USHORT", PlatformType.unsignedOf("short"), windows);
        b.add("LONG", PlatformType.of("long"), windows);
        b.add("ULONG", PlatformType.unsignedOf("long"), windows);
        b.add("DWORD", PlatformType.unsignedOf("long"), windows);
        b.add("LONGLONG", PlatformType.of("long").asLongLong(), windows);
        b.add("ULONGLONG", PlatformType.unsignedOf("long").asLongLong(), windows);
        b.add("DWORD64", PlatformType.unsignedOf("long").asLongLong(), windows);
        b.add("FLOAT", PlatformType.of("float"), windows);
        b.add("WCHAR", PlatformType.of("wchar_t"), windows);
        b.add("LPSTR", PlatformType.pointerTo("char"), windows);
        b.add("PCHAR", PlatformType.pointerTo("char"), windows);
        b.add("LPCSTR", PlatformType.constPointerTo("char"), windows);
        b.add("LPWSTR", PlatformType.pointerTo("wchar_t"), windows);
        b.add("LPCWSTR", PlatformType.constPointerTo("wchar_t"), windows);
        b.add("LPVOID", PlatformType.pointerTo("void"), windows);
        b.add("PVOID", PlatformType.pointerTo("void"), windows);
        b.add("HANDLE", PlatformType.pointerTo("void"), windows);
        b.add("LPCVOID", PlatformType.constPointerTo("void"), windows);
        b.add("LPBYTE", PlatformType.pointerTo("char").asUnsigned(), windows);
        b.add("LPDWORD", PlatformType.pointerTo("long").asUnsigned(), windows);
        b.add("PDWORD", PlatformType.pointerTo("long").asUnsigned(), windows);

        // character width depends on the unicode setting
        b.add("TCHAR", PlatformType.of("char"), List.of(Platform.WIN32A));
        b.add("LPTSTR", PlatformType.pointerTo("char"), List.of(Platform.WIN32A));
        b.add("LPCTSTR", PlatformType.constPointerTo("char"), List.of(Platform.WIN32A));
        b.add("TCHAR", PlatformType.of("wchar_t"), List.of(Platform.WIN32W, Platform.WIN64));
        b.add("LPTSTR", PlatformType.pointerTo("wchar_t"), List.of(Platform.WIN32W, Platform.WIN64));
        b.add("LPCTSTR", PlatformType.constPointerTo("wchar_t"), List.of(Platform.WIN32W, Platform.WIN64));

        // pointer sized integers
        List<String> win32 = List.of(Platform.WIN32A, Platform.WIN32W);
        b.add("SIZE_T", PlatformType.unsignedOf("long"), win32);
        b.add("UINT_PTR", PlatformType.unsignedOf("int"), win32);
        b.add("INT_PTR", PlatformType.of("int"), win32);
        b.add("SIZE_T", PlatformType.unsignedOf("long").asLongLong(), List.of(Platform.WIN64));
        b.add("UINT_PTR", PlatformType.unsignedOf("long").asLongLong(), List.of(Platform.WIN64));
        b.add("INT_PTR", PlatformType.of("long").asLongLong(), List.of(Platform.WIN64));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder seeded with the entries of this table.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        types.forEach((name, byPlatform) -> byPlatform.forEach(
                (platform, type) -> b.add(name, type, List.of(platform))));
        return b;
    }

    /**
     * Find the canonical type for an alias on the given platform.
     *
     * @return the platform type or null if the alias is unknown on that platform
     */
    public PlatformType find(String name, String platform) {
        Map<String, PlatformType> byPlatform = types.get(name);
        if (byPlatform == null) {
            return null;
        }
        return byPlatform.get(platform);
    }

    public int size() {
        return types.size();
    }

    public static final class Builder {
        private final Map<String, Map<String, PlatformType>> types = new HashMap<>();

        public Builder add(String name, PlatformType type, List<String> platforms) {
            if (platforms.isEmpty()) {
                throw new IllegalArgumentException("platform type " + name + " has no platforms");
            }
            Map<String, PlatformType> byPlatform = types.computeIfAbsent(name, k -> new HashMap<>());
            for (String platform : platforms) {
                byPlatform.put(platform, type);
            }
            return this;
        }

        public PlatformTypes build() {
            Map<String, Map<String, PlatformType>> copy = new HashMap<>();
            types.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new HashMap<>(v))));
            return new PlatformTypes(Collections.unmodifiableMap(copy));
        }
    }
}

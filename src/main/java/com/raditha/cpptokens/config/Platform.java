package com.raditha.cpptokens.config;

import java.util.Locale;

/**
 * Target platform data model used when normalizing platform dependent types.
 *
 * @param name             Platform name, also the key for platform type aliases
 * @param charBit          Bits in a char
 * @param sizeofShort      sizeof(short)
 * @param sizeofInt        sizeof(int)
 * @param sizeofLong       sizeof(long)
 * @param sizeofLongLong   sizeof(long long)
 * @param sizeofPointer    sizeof(void *)
 * @param sizeofSizeT      sizeof(size_t)
 * @param sizeofWcharT     sizeof(wchar_t)
 * @param defaultSignChar  true if plain char is signed
 */
public record Platform(
        String name,
        int charBit,
        int sizeofShort,
        int sizeofInt,
        int sizeofLong,
        int sizeofLongLong,
        int sizeofPointer,
        int sizeofSizeT,
        int sizeofWcharT,
        boolean defaultSignChar) {

    public static final String NATIVE = "native";
    public static final String UNIX32 = "unix32";
    public static final String UNIX64 = "unix64";
    public static final String WIN32A = "win32A";
    public static final String WIN32W = "win32W";
    public static final String WIN64 = "win64";

    public Platform {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("platform name cannot be empty");
        }
        if (charBit < 8) {
            throw new IllegalArgumentException("charBit must be >= 8");
        }
        if (sizeofInt <= 0 || sizeofLong <= 0 || sizeofLongLong <= 0 || sizeofSizeT <= 0) {
            throw new IllegalArgumentException("type sizes must be positive");
        }
    }

    /**
     * The host model; this library assumes an LP64 host.
     */
    public static Platform nativePlatform() {
        return new Platform(NATIVE, 8, 2, 4, 8, 8, 8, 8, 4, true);
    }

    public static Platform unix32() {
        return new Platform(UNIX32, 8, 2, 4, 4, 8, 4, 4, 4, true);
    }

    public static Platform unix64() {
        return new Platform(UNIX64, 8, 2, 4, 8, 8, 8, 8, 4, true);
    }

    public static Platform win32A() {
        return new Platform(WIN32A, 8, 2, 4, 4, 8, 4, 4, 2, true);
    }

    public static Platform win32W() {
        return new Platform(WIN32W, 8, 2, 4, 4, 8, 4, 4, 2, true);
    }

    /**
     * LLP64: long stays 32 bits while size_t is 64 bits.
     */
    public static Platform win64() {
        return new Platform(WIN64, 8, 2, 4, 4, 8, 8, 8, 2, true);
    }

    /**
     * Look up one of the built-in platform models by name (case insensitive).
     */
    public static Platform fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "native" -> nativePlatform();
            case "unix32" -> unix32();
            case "unix64" -> unix64();
            case "win32a", "win32" -> win32A();
            case "win32w" -> win32W();
            case "win64" -> win64();
            default -> throw new IllegalArgumentException("Unknown platform: " + name);
        };
    }

    public boolean isWindows() {
        return name.equals(WIN32A) || name.equals(WIN32W) || name.equals(WIN64);
    }
}

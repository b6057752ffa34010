package com.raditha.cpptokens.config;

/**
 * Canonical spelling for a platform type alias such as {@code DWORD}.
 *
 * @param type     Canonical base type, e.g. "long" or "char"
 * @param signed   Result is explicitly signed
 * @param unsigned Result is unsigned
 * @param longLong Result is "long long" (only meaningful when type is "long")
 * @param pointer  Alias is {@code type *}
 * @param ptrPtr   Alias is {@code type **}
 * @param constPtr Alias is {@code const type *}
 */
public record PlatformType(
        String type,
        boolean signed,
        boolean unsigned,
        boolean longLong,
        boolean pointer,
        boolean ptrPtr,
        boolean constPtr) {

    public PlatformType {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("platform type value cannot be empty");
        }
        if (signed && unsigned) {
            throw new IllegalArgumentException("platform type cannot be both signed and unsigned: " + type);
        }
    }

    public static PlatformType of(String type) {
        return new PlatformType(type, false, false, false, false, false, false);
    }

    public static PlatformType unsignedOf(String type) {
        return new PlatformType(type, false, true, false, false, false, false);
    }

    public static PlatformType pointerTo(String type) {
        return new PlatformType(type, false, false, false, true, false, false);
    }

    public static PlatformType constPointerTo(String type) {
        return new PlatformType(type, false, false, false, false, false, true);
    }

    public PlatformType asUnsigned() {
        return new PlatformType(type, false, true, longLong, pointer, ptrPtr, constPtr);
    }

    public PlatformType asLongLong() {
        return new PlatformType(type, signed, unsigned, true, pointer, ptrPtr, constPtr);
    }
}

package com.raditha.cpptokens.config;

import java.util.List;

/**
 * Read-only analysis settings consumed by the token list.
 * <p>
 * Instances are shared by reference; nothing in this library mutates them.
 *
 * @param platform       Target platform model
 * @param standards      Configured C and C++ standards
 * @param platformTypes  Platform type alias table
 * @param relativePaths  Report file names relative to one of the base paths
 * @param basePaths      Base paths used when relativePaths is set
 * @param cppHeaderProbe Treat {@code .h} headers as C++
 */
public record Settings(
        Platform platform,
        Standards standards,
        PlatformTypes platformTypes,
        boolean relativePaths,
        List<String> basePaths,
        boolean cppHeaderProbe) {

    public Settings {
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        if (standards == null) {
            throw new IllegalArgumentException("standards cannot be null");
        }
        if (platformTypes == null) {
            platformTypes = PlatformTypes.empty();
        }
        basePaths = basePaths == null ? List.of() : List.copyOf(basePaths);
    }

    /**
     * Native platform, C11/C++17, built-in platform types, absolute paths.
     */
    public static Settings defaults() {
        return new Settings(
                Platform.nativePlatform(),
                Standards.defaults(),
                PlatformTypes.defaults(),
                false,
                List.of(),
                false);
    }

    public Settings withPlatform(Platform newPlatform) {
        return new Settings(newPlatform, standards, platformTypes, relativePaths, basePaths, cppHeaderProbe);
    }

    public Settings withStandards(Standards newStandards) {
        return new Settings(platform, newStandards, platformTypes, relativePaths, basePaths, cppHeaderProbe);
    }

    public Settings withPlatformTypes(PlatformTypes newTypes) {
        return new Settings(platform, standards, newTypes, relativePaths, basePaths, cppHeaderProbe);
    }

    public Settings withRelativePaths(List<String> newBasePaths) {
        return new Settings(platform, standards, platformTypes, true, newBasePaths, cppHeaderProbe);
    }

    public Settings withCppHeaderProbe(boolean probe) {
        return new Settings(platform, standards, platformTypes, relativePaths, basePaths, probe);
    }
}

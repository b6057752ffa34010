package com.raditha.cpptokens.config;

/**
 * Source language of a translation unit.
 */
public enum Language {
    /** Not yet known; detected from the first registered file name. */
    NONE,
    C,
    CPP
}

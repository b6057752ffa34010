package com.raditha.cpptokens.model;

/**
 * The list a token belongs to, as seen from the token.
 */
public interface TokenOwner {

    /**
     * @return true if the text is a keyword for the owner's language and standard
     */
    boolean isKeyword(String str);

    boolean isCPP();
}

package com.raditha.cpptokens.model;

/**
 * Front and back of a token chain.
 * <p>
 * Every token of a chain refers to the same instance, so inserting or deleting at
 * either end keeps the owning list's bounds current. Relocating a list to a new
 * owner hands over this record rather than copying the chain.
 */
public final class TokensFrontBack {

    private Token front;
    private Token back;
    private TokenOwner owner;

    public TokensFrontBack(TokenOwner owner) {
        this.owner = owner;
    }

    public Token front() {
        return front;
    }

    public void front(Token token) {
        this.front = token;
    }

    public Token back() {
        return back;
    }

    public void back(Token token) {
        this.back = token;
    }

    public TokenOwner owner() {
        return owner;
    }

    public void owner(TokenOwner newOwner) {
        this.owner = newOwner;
    }

    public boolean isEmpty() {
        return front == null;
    }
}

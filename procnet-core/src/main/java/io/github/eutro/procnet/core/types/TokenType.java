package io.github.eutro.procnet.core.types;

/**
 * The type of ordering tokens, which thread side effects such as channel operations.
 */
public final class TokenType extends Type {
    public static final TokenType INSTANCE = new TokenType();

    private TokenType() {
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenType;
    }

    @Override
    public int hashCode() {
        return TokenType.class.hashCode();
    }

    @Override
    public String toString() {
        return "token";
    }
}

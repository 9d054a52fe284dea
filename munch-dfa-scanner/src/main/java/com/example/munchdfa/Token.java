package com.example.munchdfa;

/**
 * A lexeme together with the accept label of the DFA state that matched it.
 */
public final class Token {

    private final String category;
    private final String lexeme;

    public Token(String category, String lexeme) {
        if (category == null || lexeme == null) {
            throw new NullPointerException("category and lexeme are required");
        }
        this.category = category;
        this.lexeme = lexeme;
    }

    public String getCategory() { return category; }

    public String getLexeme() { return lexeme; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token t = (Token) o;
        return category.equals(t.category) && lexeme.equals(t.lexeme);
    }

    @Override
    public int hashCode() {
        return category.hashCode() * 31 + lexeme.hashCode();
    }

    @Override
    public String toString() {
        return String.format("category : %s , lexeme : %s", category, lexeme);
    }
}

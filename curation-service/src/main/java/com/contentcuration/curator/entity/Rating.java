package com.contentcuration.curator.entity;

/**
 * Curation tier assigned by the rating tool, best first.
 */
public enum Rating {
    S,
    A,
    B,
    C,
    D;

    /**
     * S and A items are the ones that make it into a digest.
     */
    public boolean isTopTier() {
        return this == S || this == A;
    }

    public static Rating fromLetter(String letter) {
        if (letter == null || letter.isBlank()) {
            throw new IllegalArgumentException("Rating letter must not be blank");
        }
        return Rating.valueOf(letter.trim().toUpperCase());
    }
}

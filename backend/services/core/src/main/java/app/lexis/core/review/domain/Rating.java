package app.lexis.core.review.domain;

public enum Rating {
    FORGOT(1), HARD(2), EASY(3);

    private final int code;
    Rating(int code) { this.code = code; }
    public int code() { return code; }

    /**
     * Accepts a rating name in any case or its keypad code ("1", "2", "3").
     */
    public static Rating fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new InvalidRatingException(v);
        }
        String token = v.trim();
        for (Rating r : values()) {
            if (r.name().equalsIgnoreCase(token) || String.valueOf(r.code).equals(token)) {
                return r;
            }
        }
        throw new InvalidRatingException(v);
    }
}

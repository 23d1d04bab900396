package app.lexis.core.review.domain;

public class InvalidRatingException extends IllegalArgumentException {

    private final String token;

    public InvalidRatingException(String token) {
        super("Unsupported rating: " + token + " (expected forgot/hard/easy or 1/2/3)");
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}

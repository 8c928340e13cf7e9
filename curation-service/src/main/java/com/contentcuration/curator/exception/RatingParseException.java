package com.contentcuration.curator.exception;

/**
 * Rating-tool output contained no recognizable rating. The item stays unrated.
 */
public class RatingParseException extends CuratorException {

    static final int EXCERPT_LENGTH = 200;

    private final String excerpt;

    public RatingParseException(String output) {
        super("RATING_PARSE_ERROR", "Could not parse rating from output: " + excerptOf(output));
        this.excerpt = excerptOf(output);
    }

    public String getExcerpt() {
        return excerpt;
    }

    static String excerptOf(String output) {
        if (output == null) {
            return "";
        }
        if (output.length() <= EXCERPT_LENGTH) {
            return output;
        }
        return output.substring(0, EXCERPT_LENGTH) + "...";
    }
}

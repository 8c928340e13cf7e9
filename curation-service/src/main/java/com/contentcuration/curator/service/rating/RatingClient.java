package com.contentcuration.curator.service.rating;

/**
 * Port to the external rating tool: composed plain text in, raw free-form verdict out.
 */
public interface RatingClient {

    String rate(String composedInput);
}

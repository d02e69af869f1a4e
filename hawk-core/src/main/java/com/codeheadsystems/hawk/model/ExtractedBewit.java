package com.codeheadsystems.hawk.model;

/**
 * A bewit removed from a request path.
 *
 * @param bewit the decoded bewit
 * @param path  the path and query with the bewit parameter removed
 */
public record ExtractedBewit(Bewit bewit, String path) {
}

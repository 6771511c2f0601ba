package com.eyelevel.watermarks.model;

/**
 * A half-open page range {@code [start, end)}.
 *
 * @param start The first page, zero-based.
 * @param end   One past the last page.
 */
public record PageRange(int start, int end) {

    public int size() {
        return end - start;
    }
}

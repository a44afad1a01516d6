package com.linesplit.util;

import lombok.Getter;

import java.util.Objects;

/**
 * A non-owning, re-pointable view over a region of a {@link String}.
 * <p>
 * The slice keeps a reference to the source string plus an offset and a length and never copies
 * characters, so {@link #wrap(String, int, int)} allocates nothing. Because the same instance is
 * re-pointed over and over, callers must not hold on to a slice after handing control back to its
 * owner: the content it shows is only meaningful until the next {@code wrap}.
 * <p>
 * Equality is identity. Use {@link #contentEquals(CharSequence)} to compare characters.
 */
public final class TextSlice implements CharSequence {

    private static final String EMPTY = "";

    @Getter
    private String source = EMPTY;
    @Getter
    private int offset;
    private int length;

    public TextSlice() {
    }

    public TextSlice(String source, int start, int end) {
        wrap(source, start, end);
    }

    /**
     * Point this slice at {@code source[start, end)}.
     *
     * @throws IndexOutOfBoundsException if the range is not within the source
     */
    public TextSlice wrap(String source, int start, int end) {
        Objects.checkFromToIndex(start, end, source.length());
        this.source = source;
        this.offset = start;
        this.length = end - start;
        return this;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public char charAt(int index) {
        Objects.checkIndex(index, length);
        return source.charAt(offset + index);
    }

    /**
     * Returns a new slice over the same source. Unlike {@link #wrap}, this allocates.
     */
    @Override
    public TextSlice subSequence(int start, int end) {
        Objects.checkFromToIndex(start, end, length);
        return new TextSlice(source, offset + start, offset + end);
    }

    @Override
    public boolean isEmpty() {
        return length == 0;
    }

    public boolean contentEquals(CharSequence other) {
        if (other == null || other.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (source.charAt(offset + i) != other.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copies the viewed characters into a new, owned string.
     */
    @Override
    public String toString() {
        return source.substring(offset, offset + length);
    }
}

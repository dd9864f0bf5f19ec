package com.scholary.lyricsync.align;

/**
 * Time span of a matched line, bounding the interpolation of its unmatched neighbours.
 *
 * @param lineIndex index of the matched line
 * @param start start of the line's first word
 * @param end end of the line's last word
 */
public record Anchor(int lineIndex, double start, double end) {}

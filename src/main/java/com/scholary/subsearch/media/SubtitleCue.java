package com.scholary.subsearch.media;

/**
 * One subtitle event as extracted from a media file's subtitle track.
 *
 * @param startMs start time in milliseconds
 * @param endMs end time in milliseconds
 * @param comment whether the event is a comment line (never shown on screen)
 * @param plainText the event text with markup removed
 */
public record SubtitleCue(long startMs, long endMs, boolean comment, String plainText) {}

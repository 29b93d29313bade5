package com.scholary.subsearch.media;

/** Loudness of a media file's audio track, as reported by volume detection. */
public record VolumeStats(double meanDb, double maxDb) {}

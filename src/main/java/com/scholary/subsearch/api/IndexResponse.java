package com.scholary.subsearch.api;

/** Location and path policy of the index. */
public record IndexResponse(String location, boolean relative) {}

package com.scholary.lyricsync.api;

/** Body returned when a request fails. */
public record ErrorResponse(String error, String message) {}

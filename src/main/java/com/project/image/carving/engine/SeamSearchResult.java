package com.project.image.carving.engine;

/** Minimum seam and the matching retention mask from one search. */
public record SeamSearchResult(Seam seam, RetentionMask mask) {}

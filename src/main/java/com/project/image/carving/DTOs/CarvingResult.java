package com.project.image.carving.DTOs;

public record CarvingResult(
        int originalWidth,
        int originalHeight,
        int workingWidth,      // after optional downsizing, before carving
        int workingHeight,
        int width,
        int height,
        int dx,
        long elapsedMillis,
        byte[] resultPng,
        byte[] seamPreviewPng  // null unless a preview of removed seams was requested
) {
    public int seamsRemoved() { return dx < 0 ? -dx : 0; }

    public int seamsInserted() { return dx > 0 ? dx : 0; }

    public boolean hasSeamPreview() { return seamPreviewPng != null && seamPreviewPng.length > 0; }
}

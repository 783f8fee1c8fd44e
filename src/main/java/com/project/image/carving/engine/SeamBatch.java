package com.project.image.carving.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Seams found for one insertion request, waiting to be applied to the original image.
 *
 * <p>Each seam is recorded in the coordinates of the shrinking working copy it was found in.
 * After a seam is committed, {@link #shiftAfterCommit(Seam)} moves every pending index at or right
 * of the committed column two places right: one for the original pixel pushed aside and one for
 * the synthesized pixel.
 */
public final class SeamBatch {
    private final Deque<int[]> pending = new ArrayDeque<>();

    /** Appends a seam in discovery order. */
    public void add(Seam seam) {
        pending.addLast(seam.toArray());
    }

    /** Removes and returns the earliest-discovered pending seam, or {@code null} when empty. */
    public Seam pollFirst() {
        int[] next = pending.pollFirst();
        return next == null ? null : new Seam(next);
    }

    public void shiftAfterCommit(Seam committed) {
        for (int[] seam : pending) {
            if (seam.length != committed.length()) {
                throw new IllegalArgumentException("Seam heights differ: " + seam.length + " vs " + committed.length());
            }
            for (int y = 0; y < seam.length; y++) {
                if (seam[y] >= committed.column(y)) {
                    seam[y] += 2;
                }
            }
        }
    }

    public int size() { return pending.size(); }

    public boolean isEmpty() { return pending.isEmpty(); }

    /** Snapshot of the pending seams in commit order. */
    public List<Seam> pending() {
        List<Seam> out = new ArrayList<>(pending.size());
        for (int[] seam : pending) {
            out.add(new Seam(seam));
        }
        return out;
    }
}

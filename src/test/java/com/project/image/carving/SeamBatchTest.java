package com.project.image.carving;

import com.project.image.carving.engine.Seam;
import com.project.image.carving.engine.SeamBatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeamBatchTest {

    @Test
    void shiftsOnlyRowsAtOrRightOfCommittedSeam() {
        SeamBatch batch = new SeamBatch();
        batch.add(Seam.of(1, 2));
        batch.add(Seam.of(1, 1));
        batch.add(Seam.of(3, 2));

        Seam first = batch.pollFirst();
        batch.shiftAfterCommit(first);
        assertThat(batch.pending()).containsExactly(Seam.of(3, 1), Seam.of(5, 4));

        Seam second = batch.pollFirst();
        batch.shiftAfterCommit(second);

        assertThat(first).isEqualTo(Seam.of(1, 2));
        assertThat(second).isEqualTo(Seam.of(3, 1));
        assertThat(batch.pollFirst()).isEqualTo(Seam.of(7, 6));
        assertThat(batch.isEmpty()).isTrue();
        assertThat(batch.pollFirst()).isNull();
    }

    @Test
    void equalIndexIsShifted() {
        SeamBatch batch = new SeamBatch();
        batch.add(Seam.of(0, 0, 0));

        batch.shiftAfterCommit(Seam.of(0, 1, 2));

        assertThat(batch.pollFirst()).isEqualTo(Seam.of(2, 0, 0));
    }

    @Test
    void leftOfCommittedSeamIsUntouched() {
        SeamBatch batch = new SeamBatch();
        batch.add(Seam.of(0, 1));

        batch.shiftAfterCommit(Seam.of(3, 3));

        assertThat(batch.pollFirst()).isEqualTo(Seam.of(0, 1));
    }

    @Test
    void rejectsSeamOfDifferentHeight() {
        SeamBatch batch = new SeamBatch();
        batch.add(Seam.of(0, 1));

        assertThatThrownBy(() -> batch.shiftAfterCommit(Seam.of(0, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6})
    void commitOrderMatchesPerSeamRecomputation(int size) {
        int height = 5, width = 10;
        List<int[]> discovered = randomSeams(size, height, width, 31L * size);

        SeamBatch batch = new SeamBatch();
        discovered.forEach(s -> batch.add(new Seam(s)));
        assertThat(batch.size()).isEqualTo(size);

        List<int[]> committed = new ArrayList<>();
        for (int k = 0; k < size; k++) {
            Seam next = batch.pollFirst();
            int[] expected = correctedFromScratch(discovered.get(k), committed);
            assertThat(next.toArray()).as("seam %d of %d", k, size).containsExactly(expected);
            committed.add(next.toArray());
            batch.shiftAfterCommit(next);
            assertThat(batch.size()).isEqualTo(size - k - 1);
        }
    }

    /** Replays every earlier commit against one seam's original coordinates. */
    private static int[] correctedFromScratch(int[] original, List<int[]> committed) {
        int[] seam = original.clone();
        for (int[] c : committed) {
            for (int y = 0; y < seam.length; y++) {
                if (seam[y] >= c[y]) seam[y] += 2;
            }
        }
        return seam;
    }

    /** Random 8-connected seams; seam k lives in an image {@code k} columns narrower. */
    private static List<int[]> randomSeams(int count, int height, int width, long seed) {
        Random rnd = new Random(seed);
        List<int[]> seams = new ArrayList<>();
        for (int k = 0; k < count; k++) {
            int w = width - k;
            int[] s = new int[height];
            s[0] = rnd.nextInt(w);
            for (int y = 1; y < height; y++) {
                s[y] = Math.max(0, Math.min(w - 1, s[y - 1] + rnd.nextInt(3) - 1));
            }
            seams.add(s);
        }
        return seams;
    }
}

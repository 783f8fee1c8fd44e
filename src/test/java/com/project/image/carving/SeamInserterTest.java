package com.project.image.carving;

import com.project.image.carving.engine.PixelImage;
import com.project.image.carving.engine.Seam;
import com.project.image.carving.engine.SeamBatch;
import com.project.image.carving.engine.SeamInserter;
import com.project.image.carving.exceptions.CarvingPreconditionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeamInserterTest {
    private final SeamInserter inserter = new SeamInserter();

    private static PixelImage gradient() {
        return TestImages.gray(new double[][]{
                {0, 40, 80, 120, 160},
                {0, 40, 80, 120, 160},
                {0, 40, 80, 120, 160}
        });
    }

    @Test
    void threeSeamsIntoFiveColumns_givesEightColumns() {
        PixelImage out = inserter.insertSeams(gradient(), 3);

        assertThat(out.width()).isEqualTo(8);
        assertThat(out.height()).isEqualTo(3);
        // discovered [0,1,1], [0,0,0], [0,0,0]; corrected to [2,0,0] and [4,2,2] before commit
        assertThat(TestImages.row(out, 0, 0)).containsExactly(0, 20, 30, 40, 60, 80, 120, 160);
        assertThat(TestImages.row(out, 1, 0)).containsExactly(0, 10, 15, 20, 40, 80, 120, 160);
        assertThat(TestImages.row(out, 2, 2)).containsExactly(0, 10, 15, 20, 40, 80, 120, 160);
    }

    @Test
    void batchedInsertionMatchesOneSeamAtATime() {
        PixelImage img = gradient();

        PixelImage batched = inserter.insertSeams(img, 3);

        List<Seam> discovered = inserter.discoverSeams(img, 3).pending();
        assertThat(discovered).containsExactly(Seam.of(0, 1, 1), Seam.of(0, 0, 0), Seam.of(0, 0, 0));

        PixelImage naive = insertOneByOne(img, discovered);

        assertThat(batched).isEqualTo(naive);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6})
    void batchedInsertionMatchesOneSeamAtATimeOnRandomImages(int count) {
        PixelImage img = TestImages.random(9, 6, 1000L + count);

        PixelImage batched = inserter.insertSeams(img, count);
        PixelImage naive = insertOneByOne(img, inserter.discoverSeams(img, count).pending());

        assertThat(batched.width()).isEqualTo(9 + count);
        assertThat(batched.height()).isEqualTo(6);
        assertThat(batched).isEqualTo(naive);
    }

    @Test
    void insertSeam_averagesWithLeftNeighbour() {
        PixelImage img = PixelImage.fromRgb(3, 1, new int[]{0x000000, 0x64C8FF, 0xFFFFFF});

        PixelImage out = inserter.insertSeam(img, Seam.of(1));

        assertThat(out.width()).isEqualTo(4);
        assertThat(out.toArray()).containsExactly(
                0, 0, 0,
                50, 100, 127.5,
                100, 200, 255,
                255, 255, 255);
    }

    @Test
    void insertSeam_inFirstColumnAveragesWithRightNeighbourAfterIt() {
        PixelImage img = TestImages.gray(new double[][]{{10, 30, 90}});

        PixelImage out = inserter.insertSeam(img, Seam.of(0));

        assertThat(TestImages.row(out, 0, 1)).containsExactly(10, 20, 30, 90);
    }

    @Test
    void insertSeam_singleColumnDuplicatesThePixel() {
        PixelImage img = TestImages.gray(new double[][]{{10}, {20}});

        PixelImage out = inserter.insertSeams(img, 1);

        assertThat(out.width()).isEqualTo(2);
        assertThat(TestImages.row(out, 0, 0)).containsExactly(10, 10);
        assertThat(TestImages.row(out, 1, 0)).containsExactly(20, 20);
    }

    @Test
    void canDoubleTheWidth() {
        PixelImage img = TestImages.random(4, 3, 5);

        assertThat(inserter.insertSeams(img, 4).width()).isEqualTo(8);
    }

    @Test
    void rejectsNonPositiveOrOversizedCounts() {
        PixelImage img = TestImages.random(4, 3, 5);

        assertThatThrownBy(() -> inserter.insertSeams(img, 0)).isInstanceOf(CarvingPreconditionException.class);
        assertThatThrownBy(() -> inserter.insertSeams(img, 5)).isInstanceOf(CarvingPreconditionException.class);
    }

    @Test
    void rejectsSeamOutsideImage() {
        PixelImage img = TestImages.random(4, 2, 5);

        assertThatThrownBy(() -> inserter.insertSeam(img, Seam.of(1, 4)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void discoverySeamsShrinkWithTheWorkingCopy() {
        PixelImage img = TestImages.random(6, 4, 11);

        SeamBatch batch = inserter.discoverSeams(img, 6);

        List<Seam> seams = batch.pending();
        assertThat(seams).hasSize(6);
        for (int k = 0; k < seams.size(); k++) {
            seams.get(k).validate(6 - k);
        }
    }

    /**
     * Reference path: insert each seam on its own, recomputing its position from the discovered
     * coordinates and every seam committed before it.
     */
    private PixelImage insertOneByOne(PixelImage img, List<Seam> discovered) {
        PixelImage out = img;
        List<int[]> committed = new ArrayList<>();
        for (Seam seam : discovered) {
            int[] position = seam.toArray();
            for (int[] earlier : committed) {
                for (int y = 0; y < position.length; y++) {
                    if (position[y] >= earlier[y]) position[y] += 2;
                }
            }
            out = inserter.insertSeam(out, new Seam(position));
            committed.add(position);
        }
        return out;
    }
}

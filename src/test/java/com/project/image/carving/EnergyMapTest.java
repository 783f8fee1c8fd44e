package com.project.image.carving;

import com.project.image.carving.engine.EnergyGrid;
import com.project.image.carving.engine.EnergyMap;
import com.project.image.carving.engine.PixelImage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EnergyMapTest {
    private final EnergyMap energyMap = new EnergyMap();

    @Test
    void twoRegionImage_matchesHandComputedCosts() {
        PixelImage img = TestImages.gray(new double[][]{
                {0, 0, 100, 100},
                {0, 0, 100, 100},
                {0, 100, 100, 100},
                {0, 0, 0, 100}
        });

        EnergyGrid energy = energyMap.computeForwardEnergy(img);

        assertThat(energy.width()).isEqualTo(4);
        assertThat(energy.height()).isEqualTo(4);
        assertThat(energy.row(0)).containsExactly(0, 0, 0, 0);
        // every entry in row 1 is a U/R or U/L tie resolved to the vertical cost
        assertThat(energy.row(1)).containsExactly(100, 100, 100, 100);
        assertThat(energy.row(2)).containsExactly(0, 100, 0, 100);
        assertThat(energy.row(3)).containsExactly(100, 0, 100, 0);
    }

    @Test
    void horizontalNeighboursWrapAroundTheRow() {
        // column 0's left neighbour is column 3 (40), its right neighbour column 1 (20)
        PixelImage img = TestImages.gray(new double[][]{
                {10, 20, 30, 40},
                {10, 20, 30, 40}
        });

        EnergyGrid energy = energyMap.computeForwardEnergy(img);

        assertThat(energy.row(1)).containsExactly(20, 20, 20, 20);
    }

    @Test
    void luminanceUsesWeightedChannels() {
        // pure red 255 -> grey 76, pure blue 255 -> grey 29
        int red = 0xFF0000, blue = 0x0000FF;
        PixelImage img = PixelImage.fromRgb(3, 2, new int[]{
                red, red, red,
                red, blue, red
        });

        EnergyGrid energy = energyMap.computeForwardEnergy(img);

        // column 0: L = red (wrap), R = blue -> cU = 47; U = red so cL = 47, cR = 94
        assertThat(energy.get(0, 1)).isEqualTo(47.0);
        // column 1: L = R = red -> cU = 0
        assertThat(energy.get(1, 1)).isEqualTo(0.0);
    }

    @Test
    void singleRowImage_hasZeroEnergy() {
        PixelImage img = TestImages.gray(new double[][]{{5, 200, 17}});

        assertThat(energyMap.computeForwardEnergy(img).row(0)).containsExactly(0, 0, 0);
    }

    @Test
    void samplesAreTruncatedBeforeGreyConversion() {
        PixelImage exact = TestImages.gray(new double[][]{{0, 0, 0}, {0, 127, 0}});
        PixelImage fractional = TestImages.gray(new double[][]{{0, 0, 0}, {0, 127.9, 0}});

        assertThat(energyMap.computeForwardEnergy(fractional).row(1))
                .containsExactly(energyMap.computeForwardEnergy(exact).row(1));
    }
}

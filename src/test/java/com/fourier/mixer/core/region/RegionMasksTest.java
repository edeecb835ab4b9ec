package com.fourier.mixer.core.region;

import com.fourier.mixer.OpenCvTestSupport;
import com.fourier.mixer.core.image.ImageShape;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RegionMasksTest extends OpenCvTestSupport {

    private static final ImageShape SHAPE = new ImageShape(6, 8);

    @Test
    public void noRectangleKeepsEverything() {
        Mat mask = RegionMasks.create(SHAPE, null, false);
        Core.MinMaxLocResult range = Core.minMaxLoc(mask);
        assertEquals(1.0, range.minVal);
        assertEquals(1.0, range.maxVal);
        assertEquals(6, mask.rows());
        assertEquals(8, mask.cols());
    }

    @Test
    public void boundsAreInclusive() {
        double[][] mask = toArray(RegionMasks.create(SHAPE, new RegionRect(2, 1, 4, 3), true));
        assertEquals(1.0, mask[1][2]);
        assertEquals(1.0, mask[3][4]);
        assertEquals(0.0, mask[0][2]);
        assertEquals(0.0, mask[1][5]);
        assertEquals(0.0, mask[4][4]);

        int ones = 0;
        for (double[] row : mask) {
            for (double v : row) {
                ones += (int) v;
            }
        }
        assertEquals(3 * 3, ones);
    }

    @Test
    public void innerAndOuterAreComplementary() {
        RegionRect rect = new RegionRect(1, 1, 5, 4);
        Mat inner = RegionMasks.create(SHAPE, rect, true);
        Mat outer = RegionMasks.create(SHAPE, rect, false);
        Mat sum = new Mat();
        Core.add(inner, outer, sum);

        Core.MinMaxLocResult range = Core.minMaxLoc(sum);
        assertEquals(1.0, range.minVal);
        assertEquals(1.0, range.maxVal);
    }

    @Test
    public void reversedCornersAreNormalized() {
        Mat forward = RegionMasks.create(SHAPE, new RegionRect(1, 2, 3, 4), true);
        Mat reversed = RegionMasks.create(SHAPE, new RegionRect(3, 4, 1, 2), true);
        assertMatEquals(forward, reversed, 0.0);
    }

    @Test
    public void coordinatesAreClampedToImage() {
        double[][] mask = toArray(RegionMasks.create(SHAPE, new RegionRect(-5, -5, 100, 100), false));
        for (double[] row : mask) {
            assertArrayEquals(new double[8], row);
        }
    }

    @Test
    public void selectionDescribesRectangle() {
        RegionSelection selection = new RegionSelection();
        Map<String, Object> empty = selection.describe();
        assertEquals(false, empty.get("hasRectangle"));
        assertEquals("Inner", empty.get("mode"));

        selection.setRectangle(new RegionRect(7, 5, 2, 1));
        selection.setInner(false);
        Map<String, Object> info = selection.describe();

        assertTrue(selection.hasRectangle());
        assertArrayEquals(new int[]{2, 1, 7, 5}, (int[]) info.get("coordinates"));
        assertEquals(5, info.get("width"));
        assertEquals(4, info.get("height"));
        assertEquals("Outer (High Frequencies)", info.get("mode"));
        assertEquals("Region: 5x4 pixels, Mode: Outer", info.get("description"));

        selection.clearRectangle();
        assertFalse(selection.hasRectangle());
        Core.MinMaxLocResult range = Core.minMaxLoc(selection.createMask(SHAPE));
        assertEquals(1.0, range.minVal);
    }
}

package com.fourier.mixer.core.mixer;

import com.fourier.mixer.OpenCvTestSupport;
import com.fourier.mixer.core.exception.EmptyImageSetException;
import com.fourier.mixer.core.exception.ShapeMismatchException;
import com.fourier.mixer.core.image.ComponentKind;
import com.fourier.mixer.core.image.ImageShape;
import com.fourier.mixer.core.image.ImageStore;
import com.fourier.mixer.core.region.RegionMasks;
import com.fourier.mixer.core.region.RegionRect;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MixingEngineTest extends OpenCvTestSupport {

    private final MixingEngine engine = new MixingEngine();

    private static NavigableMap<Integer, ImageStore> images(Mat... pixels) {
        NavigableMap<Integer, ImageStore> images = new TreeMap<>();
        for (int i = 0; i < pixels.length; i++) {
            images.put(i, loadedStore(pixels[i]));
        }
        return images;
    }

    private static Map<Integer, Double> weights(double... values) {
        Map<Integer, Double> weights = new HashMap<>();
        for (int i = 0; i < values.length; i++) {
            weights.put(i, values[i]);
        }
        return weights;
    }

    @Test
    public void singleImageMagPhaseReproducesInput() {
        Mat pixels = randomImage(16, 13, 11);
        MixRequest request = new MixRequest(MixMode.MAG_PHASE, weights(1.0), weights(1.0), images(pixels), null);
        assertMatEquals(pixels, engine.mix(request), 1e-6);
    }

    @Test
    public void singleImageRealImagReproducesInput() {
        Mat pixels = randomImage(9, 14, 12);
        MixRequest request = new MixRequest(MixMode.REAL_IMAG, weights(1.0), weights(1.0), images(pixels), null);
        assertMatEquals(pixels, engine.mix(request), 1e-6);
    }

    @Test
    public void realImagMixIsLinear() {
        Mat a = randomImage(8, 8, 1);
        Mat b = randomImage(8, 8, 2);
        MixRequest request = new MixRequest(MixMode.REAL_IMAG,
                weights(1.0, 3.0), weights(1.0, 3.0), images(a, b), null);

        double[][] expected = toArray(a);
        double[][] bb = toArray(b);
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                expected[y][x] = 0.25 * expected[y][x] + 0.75 * bb[y][x];
            }
        }
        double[][] mixed = toArray(engine.mix(request));
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                assertEquals(expected[y][x], mixed[y][x], 1e-6);
            }
        }
    }

    @Test
    public void emptyImageSetIsRejected() {
        MixRequest request = new MixRequest(MixMode.MAG_PHASE, weights(1.0), weights(1.0),
                new TreeMap<>(), null);
        assertThrows(EmptyImageSetException.class, () -> engine.mix(request));
    }

    @Test
    public void maskWithWrongShapeIsRejected() {
        Mat mask = RegionMasks.create(new ImageShape(4, 4), null, true);
        MixRequest request = new MixRequest(MixMode.MAG_PHASE, weights(1.0), weights(1.0),
                images(randomImage(8, 8, 3)), mask);
        ShapeMismatchException e = assertThrows(ShapeMismatchException.class, () -> engine.mix(request));
        assertEquals(new ImageShape(8, 8), e.getExpected());
        assertEquals(new ImageShape(4, 4), e.getActual());
    }

    @Test
    public void imagesOfDifferentSizeAreRejected() {
        NavigableMap<Integer, ImageStore> images = new TreeMap<>();
        images.put(0, loadedStore(randomImage(8, 8, 4)));
        images.put(1, loadedStore(randomImage(6, 8, 5)));
        MixRequest request = new MixRequest(MixMode.REAL_IMAG, weights(0.5, 0.5), weights(0.5, 0.5), images, null);
        assertThrows(ShapeMismatchException.class, () -> engine.mix(request));
    }

    @Test
    public void weightsForAbsentSlotsAreIgnored() {
        Mat pixels = randomImage(10, 10, 6);
        NavigableMap<Integer, ImageStore> images = new TreeMap<>();
        images.put(0, loadedStore(pixels));
        Map<Integer, Double> first = weights(0.4, 0.3, 0.2, 0.1);

        MixRequest request = new MixRequest(MixMode.MAG_PHASE, first, first, images, null);
        assertMatEquals(pixels, engine.mix(request), 1e-6);
    }

    @Test
    public void zeroWeightsFallBackToFirstImage() {
        Mat a = randomImage(8, 8, 7);
        Mat b = randomImage(8, 8, 8);
        MixRequest request = new MixRequest(MixMode.MAG_PHASE,
                weights(0.0, 0.0), Collections.emptyMap(), images(a, b), null);
        assertMatEquals(a, engine.mix(request), 1e-6);
    }

    @Test
    public void invalidWeightForAbsentSlotIsIgnored() {
        Mat pixels = randomImage(6, 6, 14);
        Map<Integer, Double> first = weights(1.0);
        first.put(3, -2.0);
        first.put(2, Double.NaN);

        MixRequest request = new MixRequest(MixMode.MAG_PHASE, first, weights(1.0), images(pixels), null);
        assertMatEquals(pixels, engine.mix(request), 1e-6);
    }

    @Test
    public void negativeWeightIsRejected() {
        MixRequest request = new MixRequest(MixMode.MAG_PHASE, weights(-0.5), weights(1.0),
                images(randomImage(4, 4, 9)), null);
        assertThrows(IllegalArgumentException.class, () -> engine.mix(request));
    }

    @Test
    public void magPhaseMaskLeavesPhaseUntouched() {
        ImageStore store = loadedStore(randomImage(12, 12, 10));
        NavigableMap<Integer, ImageStore> images = new TreeMap<>();
        images.put(0, store);
        Mat mask = RegionMasks.create(new ImageShape(12, 12), new RegionRect(4, 4, 7, 7), true);

        MixedComponents mixed = engine.mixComponents(
                new MixRequest(MixMode.MAG_PHASE, weights(1.0), weights(1.0), images, mask));

        assertMatEquals(store.getComponent(ComponentKind.PHASE), mixed.getSecond(), 0.0);
        double[][] magnitude = toArray(mixed.getFirst());
        assertEquals(0.0, magnitude[0][0], 0.0);
        assertEquals(toArray(store.getComponent(ComponentKind.MAGNITUDE))[6][6], magnitude[6][6], 1e-9);
        mixed.release();
    }

    @Test
    public void realImagMaskAppliesToBothParts() {
        ImageStore store = loadedStore(randomImage(12, 12, 13));
        NavigableMap<Integer, ImageStore> images = new TreeMap<>();
        images.put(0, store);
        Mat mask = RegionMasks.create(new ImageShape(12, 12), new RegionRect(4, 4, 7, 7), true);

        MixedComponents mixed = engine.mixComponents(
                new MixRequest(MixMode.REAL_IMAG, weights(1.0), weights(1.0), images, mask));

        double[][] real = toArray(mixed.getFirst());
        double[][] imag = toArray(mixed.getSecond());
        double[][] unmaskedReal = toArray(store.getComponent(ComponentKind.REAL));
        double[][] unmaskedImag = toArray(store.getComponent(ComponentKind.IMAG));
        for (int y = 0; y < 12; y++) {
            for (int x = 0; x < 12; x++) {
                boolean inside = y >= 4 && y <= 7 && x >= 4 && x <= 7;
                if (inside) {
                    assertEquals(unmaskedReal[y][x], real[y][x], 1e-9, "real at " + y + "," + x);
                    assertEquals(unmaskedImag[y][x], imag[y][x], 1e-9, "imag at " + y + "," + x);
                } else {
                    assertEquals(0.0, real[y][x], 0.0, "real at " + y + "," + x);
                    assertEquals(0.0, imag[y][x], 0.0, "imag at " + y + "," + x);
                }
            }
        }
        assertTrue(Math.abs(real[6][6]) > 0);
        assertTrue(Math.abs(imag[5][6]) > 0);
        assertTrue(maxAbsDifference(mixed.getFirst(), store.getComponent(ComponentKind.REAL)) > 0);
        assertTrue(maxAbsDifference(mixed.getSecond(), store.getComponent(ComponentKind.IMAG)) > 0);
        mixed.release();
    }

    @Test
    public void outerMaskRemovesDcComponent() {
        Mat pixels = constantImage(8, 8, 100.0);
        Mat mask = RegionMasks.create(new ImageShape(8, 8), new RegionRect(4, 4, 4, 4), false);
        MixRequest request = new MixRequest(MixMode.REAL_IMAG, weights(1.0), weights(1.0), images(pixels), mask);

        double[][] out = toArray(engine.mix(request));
        assertEquals(0.0, out[3][3], 1e-9);
    }
}

package com.fourier.mixer.core.image;

import com.fourier.mixer.OpenCvTestSupport;
import com.fourier.mixer.core.exception.DecodeException;
import com.fourier.mixer.core.exception.NoImageLoadedException;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ImageStoreTest extends OpenCvTestSupport {

    @Test
    public void componentBeforeLoadFails() {
        ImageStore store = new ImageStore();
        assertEquals(ImageState.EMPTY, store.getState());
        assertNull(store.getShape());
        for (ComponentKind kind : ComponentKind.values()) {
            assertThrows(NoImageLoadedException.class, () -> store.getComponent(kind));
        }
    }

    @Test
    public void loadRejectsMissingMatrix() {
        ImageStore store = new ImageStore();
        assertThrows(DecodeException.class, () -> store.load(null));
        assertThrows(DecodeException.class, () -> store.load(new Mat()));
        assertFalse(store.isLoaded());
    }

    @Test
    public void stateFollowsTransformLifecycle() {
        ImageStore store = loadedStore(randomImage(8, 8, 1));
        assertEquals(ImageState.RAW_ONLY, store.getState());

        store.getComponent(ComponentKind.RAW).release();
        assertEquals(ImageState.RAW_ONLY, store.getState());

        store.getComponent(ComponentKind.PHASE).release();
        assertEquals(ImageState.TRANSFORM_COMPUTED, store.getState());

        store.resize(new ImageShape(4, 4));
        assertEquals(ImageState.RAW_ONLY, store.getState());
    }

    @Test
    public void rawComponentIsDefensiveCopy() {
        ImageStore store = loadedStore(randomImage(6, 5, 2));
        Mat first = store.getComponent(ComponentKind.RAW);
        first.setTo(new Scalar(-1));
        Mat second = store.getComponent(ComponentKind.RAW);
        assertTrue(Core.minMaxLoc(second).minVal >= 0);
    }

    @Test
    public void spectralComponentIsDefensiveCopy() {
        ImageStore store = loadedStore(randomImage(6, 5, 3));
        Mat magnitude = store.getComponent(ComponentKind.MAGNITUDE);
        Mat expected = magnitude.clone();
        magnitude.setTo(new Scalar(0));
        assertMatEquals(expected, store.getComponent(ComponentKind.MAGNITUDE), 0.0);
    }

    @Test
    public void magnitudeOfConstantImageIsDcOnly() {
        ImageStore store = loadedStore(constantImage(4, 6, 2.0));
        double[][] magnitude = toArray(store.getComponent(ComponentKind.MAGNITUDE));
        assertEquals(4 * 6 * 2.0, magnitude[2][3], 1e-9);
        assertEquals(0.0, magnitude[0][0], 1e-9);
    }

    @Test
    public void phaseLiesInSymmetricRange() {
        ImageStore store = loadedStore(randomImage(9, 7, 4));
        Core.MinMaxLocResult range = Core.minMaxLoc(store.getComponent(ComponentKind.PHASE));
        assertTrue(range.minVal >= -Math.PI);
        assertTrue(range.maxVal <= Math.PI);
        assertTrue(range.minVal < 0, "expected negative phases from atan2");
    }

    @Test
    public void loadInvalidatesCachedMagnitude() {
        ImageStore store = loadedStore(constantImage(4, 4, 1.0));
        double before = toArray(store.getComponent(ComponentKind.MAGNITUDE))[2][2];

        store.load(constantImage(4, 4, 3.0));
        double after = toArray(store.getComponent(ComponentKind.MAGNITUDE))[2][2];

        assertEquals(16.0, before, 1e-9);
        assertEquals(48.0, after, 1e-9);
    }

    @Test
    public void resizeInvalidatesCachedMagnitude() {
        ImageStore store = loadedStore(constantImage(8, 8, 1.0));
        Mat before = store.getComponent(ComponentKind.MAGNITUDE);
        assertEquals(64.0, toArray(before)[4][4], 1e-9);

        store.resize(new ImageShape(4, 6));
        Mat after = store.getComponent(ComponentKind.MAGNITUDE);
        assertEquals(4, after.rows());
        assertEquals(6, after.cols());
        assertEquals(24.0, toArray(after)[2][3], 1e-6);
    }

    @Test
    public void resizeAlwaysStartsFromOriginal() {
        Mat pixels = randomImage(20, 16, 5);
        ImageStore store = loadedStore(pixels);

        store.resize(new ImageShape(5, 4));
        store.resize(new ImageShape(20, 16));

        assertEquals(new ImageShape(20, 16), store.getShape());
        assertEquals(new ImageShape(20, 16), store.getOriginalShape());
        assertMatEquals(pixels, store.getComponent(ComponentKind.RAW), 0.0);
    }

    @Test
    public void resizeWithoutImageIsNoOp() {
        ImageStore store = new ImageStore();
        store.resize(new ImageShape(3, 3));
        assertEquals(ImageState.EMPTY, store.getState());
    }

    @Test
    public void colorInputIsConvertedToGray() {
        Mat color = new Mat(3, 4, CvType.CV_8UC3, new Scalar(100, 100, 100));
        ImageStore store = loadedStore(color);
        Mat raw = store.getComponent(ComponentKind.RAW);
        assertEquals(CvType.CV_64F, raw.type());
        assertEquals(100.0, toArray(raw)[1][1], 0.5);
    }

    @Test
    public void displayComponentsStayInUnitRange() {
        ImageStore store = loadedStore(randomImage(10, 12, 6));
        for (ComponentKind kind : ComponentKind.values()) {
            Core.MinMaxLocResult range = Core.minMaxLoc(store.getDisplayComponent(kind));
            assertTrue(range.minVal >= 0.0, kind + " min");
            assertTrue(range.maxVal <= 1.0, kind + " max");
            assertEquals(0.0, range.minVal, 1e-12, kind + " normalized min");
            assertEquals(1.0, range.maxVal, 1e-12, kind + " normalized max");
        }
    }

    @Test
    public void displayComponentIsIdempotent() {
        ImageStore store = loadedStore(randomImage(10, 12, 7));
        for (ComponentKind kind : ComponentKind.values()) {
            double[][] first = toArray(store.getDisplayComponent(kind));
            double[][] second = toArray(store.getDisplayComponent(kind));
            for (int y = 0; y < first.length; y++) {
                assertArrayEquals(first[y], second[y], kind + " row " + y);
            }
        }
    }

    @Test
    public void displayOfFlatImageIsZero() {
        ImageStore store = loadedStore(constantImage(5, 5, 77.0));
        Core.MinMaxLocResult range = Core.minMaxLoc(store.getDisplayComponent(ComponentKind.RAW));
        assertEquals(0.0, range.maxVal);
    }

    @Test
    public void brightnessAndContrastAreClamped() {
        ImageStore store = loadedStore(randomImage(6, 6, 8));
        Mat plain = store.getDisplayComponent(ComponentKind.RAW);
        Mat adjusted = store.getDisplayComponent(ComponentKind.RAW, 0.3, 2.0);

        Core.MinMaxLocResult range = Core.minMaxLoc(adjusted);
        assertTrue(range.minVal >= 0.0);
        assertTrue(range.maxVal <= 1.0);
        assertNotEquals(0.0, maxAbsDifference(plain, adjusted));
    }

    @Test
    public void releaseReturnsToEmpty() {
        ImageStore store = loadedStore(randomImage(4, 4, 9));
        store.getComponent(ComponentKind.MAGNITUDE).release();

        store.release();

        assertEquals(ImageState.EMPTY, store.getState());
        assertNull(store.getShape());
        assertNull(store.getOriginalShape());
        assertThrows(NoImageLoadedException.class, () -> store.getComponent(ComponentKind.PHASE));
    }
}

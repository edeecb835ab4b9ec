package com.fourier.mixer.core.session;

import com.fourier.mixer.core.image.ImageShape;
import com.fourier.mixer.core.image.ImageStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 会话内的图像槽位 (0..slotCount-1) 和当前统一尺寸
 * <p>
 * 由持有者显式创建和 reset，不是全局单例。
 * 非空时，所有图像的当前尺寸都等于 commonShape（由 {@link SizeUnifier} 维护）。
 */
public class SessionRegistry {
    public static final int DEFAULT_SLOT_COUNT = 4;

    private final int slotCount;
    private final NavigableMap<Integer, ImageStore> images = new TreeMap<>();
    private ImageShape commonShape;

    public SessionRegistry() {
        this(DEFAULT_SLOT_COUNT);
    }

    public SessionRegistry(int slotCount) {
        if (slotCount <= 0) {
            throw new IllegalArgumentException("Slot count must be positive: " + slotCount);
        }
        this.slotCount = slotCount;
    }

    public synchronized void store(int slot, ImageStore image) {
        checkSlot(slot);
        if (image == null) {
            throw new IllegalArgumentException("Image must not be null");
        }
        images.put(slot, image);
    }

    public synchronized ImageStore get(int slot) {
        checkSlot(slot);
        return images.get(slot);
    }

    public synchronized boolean remove(int slot) {
        checkSlot(slot);
        boolean removed = images.remove(slot) != null;
        if (images.isEmpty()) {
            commonShape = null;
        }
        return removed;
    }

    /**
     * 按槽位顺序的快照，后续对注册表的增删不影响已取得的快照
     */
    public synchronized NavigableMap<Integer, ImageStore> snapshot() {
        return Collections.unmodifiableNavigableMap(new TreeMap<>(images));
    }

    public synchronized List<ImageStore> getAllImages() {
        return new ArrayList<>(images.values());
    }

    public synchronized int getImageCount() {
        return images.size();
    }

    public synchronized boolean isEmpty() {
        return images.isEmpty();
    }

    public synchronized ImageShape getCommonShape() {
        return commonShape;
    }

    synchronized void updateCommonShape(ImageShape shape) {
        this.commonShape = shape;
    }

    /**
     * 清空所有槽位并释放图像；调用前须确保没有任务仍在读取这些图像
     */
    public synchronized void reset() {
        for (ImageStore image : images.values()) {
            image.release();
        }
        images.clear();
        commonShape = null;
    }

    public int getSlotCount() {
        return slotCount;
    }

    public boolean isValidSlot(int slot) {
        return slot >= 0 && slot < slotCount;
    }

    private void checkSlot(int slot) {
        if (!isValidSlot(slot)) {
            throw new IllegalArgumentException("Slot index out of range [0, " + (slotCount - 1) + "]: " + slot);
        }
    }
}

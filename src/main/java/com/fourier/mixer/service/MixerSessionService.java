package com.fourier.mixer.service;

import com.fourier.mixer.config.MixerConfig;
import com.fourier.mixer.config.NativeLibraryLoader;
import com.fourier.mixer.core.exception.JobException;
import com.fourier.mixer.core.exception.MixerException;
import com.fourier.mixer.core.image.ComponentKind;
import com.fourier.mixer.core.image.ImageShape;
import com.fourier.mixer.core.image.ImageStore;
import com.fourier.mixer.core.image.Matrices;
import com.fourier.mixer.core.image.OpenCvImageDecoder;
import com.fourier.mixer.core.job.MixJobRunner;
import com.fourier.mixer.core.job.MixStatus;
import com.fourier.mixer.core.mixer.ComponentGroup;
import com.fourier.mixer.core.mixer.MixMode;
import com.fourier.mixer.core.mixer.MixRequest;
import com.fourier.mixer.core.mixer.MixingEngine;
import com.fourier.mixer.core.region.RegionRect;
import com.fourier.mixer.core.region.RegionSelection;
import com.fourier.mixer.core.session.SessionRegistry;
import com.fourier.mixer.core.session.SizeUnifier;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 混合会话服务
 * <p>
 * 对外边界：上传、显示、权重/模式/区域设置、启动混合和轮询。
 * 持有会话注册表、任务调度器以及前端设置的状态（权重、分组、模式、区域）。
 * 核心层异常在这里转换为 {status: error, message} 结构。
 */
@Service
public class MixerSessionService {
    private static final Logger logger = LoggerFactory.getLogger(MixerSessionService.class);

    private final MixerConfig config;
    private final OpenCvImageDecoder decoder;
    private final SizeUnifier unifier;
    private final MixingEngine engine;

    private SessionRegistry registry;
    private MixJobRunner jobRunner;

    private final RegionSelection region = new RegionSelection();
    private final Map<Integer, Double> weights = new TreeMap<>();
    private final Map<Integer, ComponentGroup> groups = new TreeMap<>();
    private MixMode mode = MixMode.MAG_PHASE;

    @Autowired
    public MixerSessionService(MixerConfig config, OpenCvImageDecoder decoder,
                               SizeUnifier unifier, MixingEngine engine) {
        this.config = config;
        this.decoder = decoder;
        this.unifier = unifier;
        this.engine = engine;
    }

    @PostConstruct
    public void init() {
        NativeLibraryLoader.loadNativeLibraries();
        registry = new SessionRegistry(config.getSession().getSlots());
        jobRunner = new MixJobRunner(engine, config.getJob().getCancelJoinMillis());
        resetControls();
        logger.info("Mixer session initialized - slots: {}, mode: {}, cancel join: {} ms",
                registry.getSlotCount(), mode, config.getJob().getCancelJoinMillis());
    }

    @PreDestroy
    public void shutdown() {
        if (jobRunner != null) {
            jobRunner.shutdown();
        }
    }

    // ===== 图像 =====

    /**
     * 上传 base64 图像（可带 data URL 前缀）
     */
    public Map<String, Object> uploadBase64(int slot, String content, ComponentKind displayKind) {
        if (content == null || content.isBlank()) {
            return error("No content provided");
        }
        Mat pixels;
        try {
            pixels = decoder.decodeBase64(content);
        } catch (MixerException e) {
            logger.warn("Failed to decode upload for slot {}: {}", slot, e.getMessage());
            return error(e.getMessage());
        }
        try {
            return upload(slot, pixels, displayKind);
        } finally {
            pixels.release();
        }
    }

    /**
     * 上传已解码的灰度矩阵
     */
    public Map<String, Object> uploadPixels(int slot, double[][] rows, ComponentKind displayKind) {
        Mat pixels;
        try {
            pixels = Matrices.fromArray(rows);
        } catch (MixerException e) {
            return error(e.getMessage());
        }
        try {
            return upload(slot, pixels, displayKind);
        } finally {
            pixels.release();
        }
    }

    /**
     * 存入槽位、统一尺寸，并返回原图和频域分量的显示数据
     */
    public synchronized Map<String, Object> upload(int slot, Mat pixels, ComponentKind displayKind) {
        if (!registry.isValidSlot(slot)) {
            return error("Slot index out of range [0, " + (registry.getSlotCount() - 1) + "]: " + slot);
        }
        ComponentKind kind = displayKind != null ? displayKind : defaultDisplayKind();

        try {
            ImageStore image = new ImageStore();
            image.load(pixels);
            registry.store(slot, image);
            unifier.enforceUnifiedSize(registry);

            ImageShape shape = image.getShape();
            logger.info("Image {} uploaded: original={}, unified={}", slot + 1,
                    image.getOriginalShape(), registry.getCommonShape());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "success");
            response.put("message", "Image " + (slot + 1) + " uploaded successfully");
            response.put("rawImageData", displayArray(image, ComponentKind.RAW, 0.0, 1.0));
            response.put("ftComponentData", displayArray(image, kind, 0.0, 1.0));
            response.put("ftComponentType", kind.getKey());
            response.put("imageShape", shape.toArray());
            response.put("unifiedShape", registry.getCommonShape().toArray());
            return response;

        } catch (MixerException | IllegalArgumentException e) {
            logger.warn("Upload to slot {} failed: {}", slot, e.getMessage());
            return error(e.getMessage());
        }
    }

    public synchronized Map<String, Object> removeImage(int slot) {
        if (!registry.isValidSlot(slot)) {
            return error("Slot index out of range: " + slot);
        }
        if (!registry.remove(slot)) {
            return error("No image in slot " + slot);
        }
        unifier.enforceUnifiedSize(registry);
        logger.info("Image {} removed, unified shape now {}", slot + 1, registry.getCommonShape());

        Map<String, Object> response = success("Image " + (slot + 1) + " removed");
        ImageShape common = registry.getCommonShape();
        response.put("unifiedShape", common == null ? null : common.toArray());
        return response;
    }

    /**
     * 切换显示分量时调用，槽位为空或出错时返回 null
     */
    public double[][] selectDisplay(int slot, ComponentKind kind, double brightness, double contrast) {
        if (!registry.isValidSlot(slot)) {
            return null;
        }
        ImageStore image = registry.get(slot);
        if (image == null) {
            return null;
        }
        try {
            return displayArray(image, kind, brightness, contrast);
        } catch (MixerException e) {
            logger.warn("Display of slot {} ({}) failed: {}", slot, kind.getKey(), e.getMessage());
            return null;
        }
    }

    // ===== 混合设置 =====

    /**
     * 设置槽位权重，group 为 null 时保持原分组
     */
    public synchronized Map<String, Object> setWeight(int slot, Double weight, ComponentGroup group) {
        if (!registry.isValidSlot(slot)) {
            return error("Slot index out of range: " + slot);
        }
        if (weight == null || weight.isNaN() || weight < 0 || weight > 1) {
            return error("Weight must be between 0 and 1");
        }
        weights.put(slot, weight);
        if (group != null) {
            groups.put(slot, group);
        }
        logger.debug("Slot {} weight={} group={}", slot, weight, groups.get(slot));

        Map<String, Object> response = success(null);
        response.put("value", weight);
        response.put("group", groups.get(slot).name());
        return response;
    }

    public synchronized void setMode(MixMode newMode) {
        if (newMode == null) {
            throw new IllegalArgumentException("Mix mode is required");
        }
        if (newMode != mode) {
            logger.info("Mix mode changed: {} -> {}", mode, newMode);
        }
        this.mode = newMode;
    }

    public synchronized MixMode getMode() {
        return mode;
    }

    /**
     * 设置区域；rect 为 null 时只更新内/外模式
     */
    public synchronized Map<String, Object> setRegion(RegionRect rect, Boolean inner) {
        if (rect != null) {
            region.setRectangle(rect);
        }
        if (inner != null) {
            region.setInner(inner);
        }
        return region.describe();
    }

    public synchronized Map<String, Object> clearRegion() {
        region.clearRectangle();
        return region.describe();
    }

    // ===== 混合任务 =====

    /**
     * 收集当前权重/模式/区域，提交后台混合，立即返回任务编号
     */
    public synchronized long startMix() {
        Map<Integer, Double> component1 = new TreeMap<>();
        Map<Integer, Double> component2 = new TreeMap<>();
        for (Map.Entry<Integer, Double> entry : weights.entrySet()) {
            ComponentGroup group = groups.getOrDefault(entry.getKey(), ComponentGroup.FIRST);
            if (group == ComponentGroup.FIRST) {
                component1.put(entry.getKey(), entry.getValue());
            } else {
                component2.put(entry.getKey(), entry.getValue());
            }
        }

        ImageShape common = registry.getCommonShape();
        Mat mask = region.hasRectangle() && common != null ? region.createMask(common) : null;

        MixRequest request = new MixRequest(mode, component1, component2, registry.snapshot(), mask);
        return jobRunner.submit(request);
    }

    public double pollProgress() {
        return jobRunner.pollProgress();
    }

    public double[][] pollResult() {
        Mat result = jobRunner.pollResult();
        if (result == null) {
            return null;
        }
        try {
            return Matrices.toArray(result);
        } finally {
            result.release();
        }
    }

    public boolean isRunning() {
        return jobRunner.isRunning();
    }

    /**
     * 轮询用的一致快照：progress、running、error（失败时）、result（可用且需要时）
     */
    public Map<String, Object> getMixStatus(boolean includeResult) {
        MixStatus status = jobRunner.status(includeResult);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", status.getJobId());
        data.put("progress", status.getProgress());
        data.put("running", status.isRunning());
        if (status.isFailed() && status.getError() != null) {
            data.put("error", status.getError().getMessage());
        }
        Mat result = status.getResult();
        if (result != null) {
            try {
                data.put("result", Matrices.toArray(result));
            } finally {
                result.release();
            }
        }
        return data;
    }

    public String getLastErrorMessage() {
        JobException error = jobRunner.getLastError();
        return error == null ? null : error.getMessage();
    }

    // ===== 会话 =====

    public synchronized Map<String, Object> getSessionState() {
        Map<String, Object> state = new LinkedHashMap<>();
        List<Map<String, Object>> slots = new ArrayList<>();
        for (int slot = 0; slot < registry.getSlotCount(); slot++) {
            Map<String, Object> info = new LinkedHashMap<>();
            ImageStore image = registry.get(slot);
            info.put("slot", slot);
            info.put("loaded", image != null);
            if (image != null) {
                info.put("imageShape", image.getShape().toArray());
                info.put("originalShape", image.getOriginalShape().toArray());
                info.put("state", image.getState().name());
            }
            info.put("weight", weights.get(slot));
            info.put("group", groups.get(slot).name());
            slots.add(info);
        }
        ImageShape common = registry.getCommonShape();
        state.put("slots", slots);
        state.put("unifiedShape", common == null ? null : common.toArray());
        state.put("mode", mode.name());
        state.put("region", region.describe());
        state.put("running", jobRunner.isRunning());
        state.put("progress", jobRunner.pollProgress());
        return state;
    }

    /**
     * 页面重新加载时调用：取消任务，清空图像和所有设置
     */
    public synchronized void reset() {
        jobRunner.cancelRunning();
        registry.reset();
        resetControls();
        logger.info("Mixer session reset");
    }

    SessionRegistry getRegistry() {
        return registry;
    }

    // ===== 内部 =====

    private void resetControls() {
        weights.clear();
        groups.clear();
        for (int slot = 0; slot < registry.getSlotCount(); slot++) {
            weights.put(slot, config.getSession().getDefaultWeight());
            groups.put(slot, ComponentGroup.FIRST);
        }
        mode = MixMode.fromName(config.getSession().getDefaultMode());
        region.clearRectangle();
        region.setInner(true);
    }

    private ComponentKind defaultDisplayKind() {
        return ComponentKind.fromName(config.getSession().getDefaultDisplayComponent());
    }

    private static double[][] displayArray(ImageStore image, ComponentKind kind, double brightness, double contrast) {
        Mat display = image.getDisplayComponent(kind, brightness, contrast);
        try {
            return Matrices.toArray(display);
        } finally {
            display.release();
        }
    }

    private static Map<String, Object> success(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        if (message != null) {
            response.put("message", message);
        }
        return response;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return response;
    }
}

package com.fourier.mixer.controller;

import com.fourier.mixer.core.image.ComponentKind;
import com.fourier.mixer.core.mixer.ComponentGroup;
import com.fourier.mixer.core.mixer.MixMode;
import com.fourier.mixer.core.region.RegionRect;
import com.fourier.mixer.dto.ModeRequest;
import com.fourier.mixer.dto.RegionRequest;
import com.fourier.mixer.dto.UploadImageRequest;
import com.fourier.mixer.dto.WeightRequest;
import com.fourier.mixer.service.MixerSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 频域混合控制器
 *
 * 提供图像上传、分量显示、混合参数设置、后台混合及进度轮询
 */
@RestController
@RequestMapping("/api/mixer")
@Tag(name = "频域混合", description = "图像上传、分量显示、混合设置与后台混合任务")
public class MixerController {
    private static final Logger logger = LoggerFactory.getLogger(MixerController.class);

    @Autowired
    private MixerSessionService sessionService;

    // ===== 图像 =====

    @PostMapping("/images/{slot}")
    @Operation(
            summary = "上传图像",
            description = """
                    上传一张图像到指定槽位 (0-3)，转为灰度后统一所有图像尺寸。

                    - `image`：base64 图像（支持 `data:image/png;base64,...`）
                    - `pixels`：已解码的灰度矩阵，与 image 二选一
                    - `component`：同时返回的频域显示分量，默认 magnitude

                    返回原图和频域分量的显示数据（取值 [0,1]）、图像尺寸以及统一尺寸。
                    """
    )
    public ResponseEntity<Map<String, Object>> upload(
            @Parameter(description = "槽位 0-3") @PathVariable int slot,
            @RequestBody UploadImageRequest request) {
        try {
            ComponentKind kind = request.getComponent() == null ? null : ComponentKind.fromName(request.getComponent());

            Map<String, Object> result;
            if (request.getPixels() != null) {
                result = sessionService.uploadPixels(slot, request.getPixels(), kind);
            } else {
                result = sessionService.uploadBase64(slot, request.getImage(), kind);
            }
            return toResponse(result);

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to upload image to slot {}", slot, e);
            return serverError(e);
        }
    }

    @DeleteMapping("/images/{slot}")
    @Operation(summary = "移除图像", description = "清空槽位并重新计算统一尺寸（可能变大）")
    public ResponseEntity<Map<String, Object>> remove(@PathVariable int slot) {
        return toResponse(sessionService.removeImage(slot));
    }

    @GetMapping("/images/{slot}/display")
    @Operation(
            summary = "获取分量显示数据",
            description = "component: raw / magnitude / phase / real / imag。结果取值 [0,1]，槽位为空时 404"
    )
    public ResponseEntity<Map<String, Object>> display(
            @PathVariable int slot,
            @RequestParam(defaultValue = "magnitude") String component,
            @RequestParam(defaultValue = "0.0") double brightness,
            @RequestParam(defaultValue = "1.0") double contrast) {
        Map<String, Object> response = new HashMap<>();
        try {
            ComponentKind kind = ComponentKind.fromName(component);
            double[][] data = sessionService.selectDisplay(slot, kind, brightness, contrast);
            if (data == null) {
                response.put("status", "error");
                response.put("message", "No image in slot " + slot);
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("component", kind.getKey());
            payload.put("data", data);
            response.put("status", "success");
            response.put("data", payload);
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    // ===== 混合设置 =====

    @PutMapping("/weights/{slot}")
    @Operation(summary = "设置权重", description = "weight 取值 [0,1]；group 为 first（幅值/实部）或 second（相位/虚部）")
    public ResponseEntity<Map<String, Object>> setWeight(@PathVariable int slot, @RequestBody WeightRequest request) {
        try {
            ComponentGroup group = request.getGroup() == null ? null : ComponentGroup.fromName(request.getGroup());
            return toResponse(sessionService.setWeight(slot, request.getWeight(), group));
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    @PutMapping("/mode")
    @Operation(summary = "设置混合模式", description = "mag_phase 或 real_imag")
    public ResponseEntity<Map<String, Object>> setMode(@RequestBody ModeRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            MixMode mode = MixMode.fromName(request.getMode());
            sessionService.setMode(mode);

            Map<String, Object> data = new HashMap<>();
            data.put("mode", mode.name());
            data.put("components", new String[]{mode.first().getKey(), mode.second().getKey()});
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    @PutMapping("/region")
    @Operation(
            summary = "设置频域区域",
            description = "矩形 (x1,y1,x2,y2) 为像素坐标，两端包含；inner=true 保留低频，false 保留高频"
    )
    public ResponseEntity<Map<String, Object>> setRegion(@RequestBody RegionRequest request) {
        if (request.hasPartialRectangle()) {
            return badRequest("x1, y1, x2 and y2 must be given together");
        }
        RegionRect rect = request.hasRectangle()
                ? new RegionRect(request.getX1(), request.getY1(), request.getX2(), request.getY2())
                : null;

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", sessionService.setRegion(rect, request.getInner()));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/region")
    @Operation(summary = "清除频域区域", description = "恢复为不限区域（全 1 掩码）")
    public ResponseEntity<Map<String, Object>> clearRegion() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", sessionService.clearRegion());
        return ResponseEntity.ok(response);
    }

    // ===== 混合任务 =====

    @PostMapping("/mix")
    @Operation(summary = "启动混合", description = "取消正在运行的混合并启动新任务，立即返回；之后轮询 /mix/status")
    public ResponseEntity<Map<String, Object>> startMix() {
        Map<String, Object> response = new HashMap<>();
        try {
            long jobId = sessionService.startMix();

            Map<String, Object> data = new HashMap<>();
            data.put("jobId", jobId);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Failed to start mixing job", e);
            return serverError(e);
        }
    }

    @GetMapping("/mix/status")
    @Operation(
            summary = "轮询混合进度",
            description = "progress 取值 [0,1]，-1 表示任务失败（需重新提交）；结果可用时返回 result 矩阵（取值 [0,255]）"
    )
    public ResponseEntity<Map<String, Object>> mixStatus(
            @RequestParam(defaultValue = "true") boolean includeResult) {
        Map<String, Object> data = sessionService.getMixStatus(includeResult);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    // ===== 会话 =====

    @GetMapping("/session")
    @Operation(summary = "会话状态", description = "各槽位尺寸、权重、分组，统一尺寸，模式，区域和任务状态")
    public ResponseEntity<Map<String, Object>> session() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", sessionService.getSessionState());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/session/reset")
    @Operation(summary = "重置会话", description = "取消任务，清空所有图像和设置")
    public ResponseEntity<Map<String, Object>> reset() {
        sessionService.reset();
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Session reset");
        return ResponseEntity.ok(response);
    }

    // ===== 辅助 =====

    private ResponseEntity<Map<String, Object>> toResponse(Map<String, Object> result) {
        if ("error".equals(result.get("status"))) {
            return ResponseEntity.badRequest().body(result);
        }
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<Map<String, Object>> badRequest(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.badRequest().body(response);
    }

    private ResponseEntity<Map<String, Object>> serverError(Exception e) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}

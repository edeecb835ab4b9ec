package com.fourier.mixer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fourierMixerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fourier Mixer API")
                        .description("""
                                频域图像混合服务 API 文档

                                ## 功能概述

                                最多四张灰度图像分别做二维傅里叶变换，按权重混合
                                幅值/相位（或实部/虚部），可选频域矩形区域，再逆变换得到混合图像。

                                ### 使用流程
                                ```
                                1. POST /api/mixer/images/{slot} 上传图像（自动统一尺寸）
                                2. PUT  /api/mixer/weights/{slot} 设置权重和分量组
                                3. PUT  /api/mixer/mode、/api/mixer/region 设置模式和区域
                                4. POST /api/mixer/mix 启动后台混合
                                5. GET  /api/mixer/mix/status 轮询进度和结果
                                ```

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> {
            if (openApi.getPaths() == null) {
                return;
            }
            openApi.getPaths().forEach((path, pathItem) -> {
                if (pathItem.getGet() != null) {
                    pathItem.getGet().getResponses().addApiResponse("200", createSuccessResponse());
                }
                if (pathItem.getPost() != null) {
                    pathItem.getPost().getResponses().addApiResponse("200", createSuccessResponse());
                    pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
                }
                if (pathItem.getPut() != null) {
                    pathItem.getPut().getResponses().addApiResponse("400", createBadRequestResponse());
                }
            });
        };
    }

    private ApiResponse createSuccessResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));

        return new ApiResponse()
                .description("成功")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("Weight must be between 0 and 1")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}

package com.calai.portion.volume.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * application.yml:
 * app.volume.*
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.volume")
public class VolumeEstimationProperties {

    /**
     * 參考物偵測 + 深度估計最多等多久（超過就當作沒有證據）。
     * executor 滿了的任務直接拒絕、不在呼叫端執行緒跑，所以這個上限永遠成立。
     */
    @NotNull
    private Duration evidenceTimeout = Duration.ofSeconds(2);

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Reference reference = new Reference();

    @Valid
    private Depth depth = new Depth();

    @Valid
    private Models models = new Models();

    @Valid
    private Density density = new Density();

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 8;
        @Min(0)
        private int queueCapacity = 200;
    }

    @Data
    public static class Reference {
        /** NONE：沒有偵測模型（永遠回空清單） */
        @NotBlank
        private String backend = "NONE";

        /** 低於（含）這個分數的偵測直接丟掉 */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.0;
    }

    @Data
    public static class Depth {
        /** NONE / STUB */
        @NotBlank
        private String backend = "NONE";

        /** 深度圖本身信心不足就當作沒有深度 */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.5;

        /** STUB backend 回傳的固定深度（cm） */
        @DecimalMin(value = "0.0", inclusive = false)
        private double stubDepthCm = 6.0;
    }

    @Data
    public static class Models {
        /** 模型載入失敗後，多久之後才允許重試 */
        @NotNull
        private Duration retryAfter = Duration.ofMinutes(5);
    }

    @Data
    public static class Density {
        @NotBlank
        private String seedLocation = "classpath:volume/food-densities.json";

        /** 依食物名稱覆寫 / 追加 seed（key = 食物名稱） */
        private Map<String, DensityOverride> overrides = new LinkedHashMap<>();
    }

    @Data
    public static class DensityOverride {
        private Double density;
        private Double densityVariance;
        private String shape;
        private Double compressibility;
    }
}

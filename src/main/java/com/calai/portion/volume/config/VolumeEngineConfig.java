package com.calai.portion.volume.config;

import com.calai.portion.volume.density.FoodDensityRepository;
import com.calai.portion.volume.density.FoodDensitySeedLoader;
import com.calai.portion.volume.density.InMemoryFoodDensityRepository;
import com.calai.portion.volume.depth.DepthEstimator;
import com.calai.portion.volume.depth.DepthModel;
import com.calai.portion.volume.depth.ModelDepthEstimator;
import com.calai.portion.volume.depth.StubDepthModel;
import com.calai.portion.volume.inference.LazyModel;
import com.calai.portion.volume.inference.ModelLoader;
import com.calai.portion.volume.inference.ModelUnavailableException;
import com.calai.portion.volume.reference.CatalogReferenceObjectDetector;
import com.calai.portion.volume.reference.ReferenceDetectionModel;
import com.calai.portion.volume.reference.ReferenceObjectDetector;
import com.calai.portion.volume.telemetry.EstimationTelemetry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.Locale;

/**
 * 模型 backend 由 app.volume.depth.backend / app.volume.reference.backend 決定：
 * - NONE：沒有模型（估算會自動降級）
 * - STUB：固定深度（只有 depth 有）
 * - CUSTOM：使用整合端自行註冊的 DepthModel / ReferenceDetectionModel bean
 * 模型都是第一次用到才載入。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(VolumeEstimationProperties.class)
public class VolumeEngineConfig {

    @Bean
    @ConditionalOnMissingBean(FoodDensityRepository.class)
    public FoodDensityRepository foodDensityRepository(VolumeEstimationProperties props,
                                                       ObjectMapper om,
                                                       ResourceLoader resourceLoader) {
        FoodDensitySeedLoader loader = new FoodDensitySeedLoader(om, resourceLoader);
        return new InMemoryFoodDensityRepository(loader.load(props.getDensity()));
    }

    @Bean(destroyMethod = "close")
    public LazyModel<DepthModel> depthModel(VolumeEstimationProperties props,
                                            ObjectProvider<DepthModel> custom) {
        String backend = norm(props.getDepth().getBackend());
        ModelLoader<DepthModel> loader = switch (backend) {
            case "NONE" -> () -> {
                throw new ModelUnavailableException("DEPTH_BACKEND_NOT_CONFIGURED");
            };
            case "STUB" -> () -> new StubDepthModel(props.getDepth().getStubDepthCm());
            case "CUSTOM" -> () -> custom.getObject();
            default -> throw new IllegalStateException("DEPTH_BACKEND_UNKNOWN: " + backend);
        };
        log.info("Depth model configured. backend={}", backend);
        return new LazyModel<>("depth-" + backend, loader, props.getModels().getRetryAfter());
    }

    @Bean(destroyMethod = "close")
    public LazyModel<ReferenceDetectionModel> referenceDetectionModel(VolumeEstimationProperties props,
                                                                      ObjectProvider<ReferenceDetectionModel> custom) {
        String backend = norm(props.getReference().getBackend());
        ModelLoader<ReferenceDetectionModel> loader = switch (backend) {
            case "NONE" -> () -> {
                throw new ModelUnavailableException("REFERENCE_BACKEND_NOT_CONFIGURED");
            };
            case "CUSTOM" -> () -> custom.getObject();
            default -> throw new IllegalStateException("REFERENCE_BACKEND_UNKNOWN: " + backend);
        };
        log.info("Reference detection model configured. backend={}", backend);
        return new LazyModel<>("reference-" + backend, loader, props.getModels().getRetryAfter());
    }

    @Bean
    public DepthEstimator depthEstimator(LazyModel<DepthModel> depthModel, VolumeEstimationProperties props,
                                         EstimationTelemetry telemetry) {
        return new ModelDepthEstimator(depthModel, props.getDepth().getMinConfidence(), telemetry);
    }

    @Bean
    public ReferenceObjectDetector referenceObjectDetector(LazyModel<ReferenceDetectionModel> referenceDetectionModel,
                                                           VolumeEstimationProperties props,
                                                           EstimationTelemetry telemetry) {
        return new CatalogReferenceObjectDetector(referenceDetectionModel, props.getReference().getMinConfidence(),
                telemetry);
    }

    private static String norm(String s) {
        if (s == null) return "NONE";
        String v = s.trim().toUpperCase(Locale.ROOT);
        return v.isEmpty() ? "NONE" : v;
    }
}

package com.calai.portion.volume.health;

import com.calai.portion.volume.density.FoodDensityRepository;
import com.calai.portion.volume.depth.DepthModel;
import com.calai.portion.volume.inference.LazyModel;
import com.calai.portion.volume.reference.ReferenceDetectionModel;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * ✅ 自檢（不觸發模型載入）：
 * - 密度表有資料 -> UP（模型缺席只會降低準確度，估算仍可用）
 * - 密度表空 -> DOWN
 */
@Component
public class VolumeModelsHealthIndicator implements HealthIndicator {

    private final LazyModel<DepthModel> depthModel;
    private final LazyModel<ReferenceDetectionModel> referenceModel;
    private final FoodDensityRepository densityRepository;

    public VolumeModelsHealthIndicator(LazyModel<DepthModel> depthModel,
                                       LazyModel<ReferenceDetectionModel> referenceModel,
                                       FoodDensityRepository densityRepository) {
        this.depthModel = depthModel;
        this.referenceModel = referenceModel;
        this.densityRepository = densityRepository;
    }

    @Override
    public Health health() {
        int foods = densityRepository.size();
        Health.Builder b = (foods > 0)
                ? Health.up()
                : Health.down().withDetail("reason", "DENSITY_TABLE_EMPTY");

        b.withDetail("densityEntries", foods)
                .withDetail("depthModel", depthModel.state().name())
                .withDetail("referenceModel", referenceModel.state().name());

        if (depthModel.lastError() != null) b.withDetail("depthModelError", depthModel.lastError());
        if (referenceModel.lastError() != null) b.withDetail("referenceModelError", referenceModel.lastError());
        return b.build();
    }
}

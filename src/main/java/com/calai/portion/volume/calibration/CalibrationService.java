package com.calai.portion.volume.calibration;

import com.calai.portion.volume.density.FoodDensityRepository;
import com.calai.portion.volume.exception.InvalidEstimationInputException;
import com.calai.portion.volume.model.FoodDensityEntry;
import com.calai.portion.volume.model.VolumeEstimationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 使用者回報實際重量（與體積）後修正密度表。
 * <p>
 * 規則：newDensity = (currentDensity + actualDensity) / 2，每次回饋套用一次。
 * 只影響之後的估算，不回頭改舊結果。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class CalibrationService {

    private final FoodDensityRepository densityRepository;

    /**
     * @param actualVolume 沒有體積就無法區分「體積估錯」還是「密度估錯」-> 不更新（不是錯誤）
     */
    public void calibrate(String foodName, VolumeEstimationResult priorResult,
                          double actualWeight, Double actualVolume) {
        if (foodName == null || foodName.isBlank()) throw new InvalidEstimationInputException("FOOD_NAME_REQUIRED");
        if (!Double.isFinite(actualWeight) || actualWeight <= 0) {
            throw new InvalidEstimationInputException("ACTUAL_WEIGHT_INVALID", String.valueOf(actualWeight));
        }
        if (actualVolume != null && (!Double.isFinite(actualVolume) || actualVolume <= 0)) {
            throw new InvalidEstimationInputException("ACTUAL_VOLUME_INVALID", String.valueOf(actualVolume));
        }

        logPriorError(foodName, priorResult, actualWeight);

        if (actualVolume == null) {
            log.debug("density_calibration skipped food={} reason=NO_ACTUAL_VOLUME", foodName);
            return;
        }

        double actualDensity = actualWeight / actualVolume;
        double[] old = new double[1];

        FoodDensityEntry updated = densityRepository.update(foodName, cur -> {
            old[0] = cur.density();
            return cur.withDensity(twoPointAverage(cur.density(), actualDensity));
        });

        log.info("density_calibrated food={} old={} observed={} new={}",
                foodName, fmt(old[0]), fmt(actualDensity), fmt(updated.density()));
    }

    static double twoPointAverage(double current, double observed) {
        return (current + observed) / 2.0;
    }

    private static void logPriorError(String foodName, VolumeEstimationResult prior, double actualWeight) {
        if (prior == null) return;
        long est = prior.estimatedWeight();
        double ratio = (actualWeight > 0) ? (est - actualWeight) / actualWeight : 0.0;
        log.info("volume_feedback food={} method={} estimatedWeightG={} actualWeightG={} errorRatio={}",
                foodName, prior.method().code(), est, fmt(actualWeight), fmt(ratio));
    }

    private static String fmt(double v) {
        return String.format("%.4f", v);
    }
}

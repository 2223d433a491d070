package com.calai.portion.volume.reference;

import com.calai.portion.volume.inference.LazyModel;
import com.calai.portion.volume.inference.ModelUnavailableException;
import com.calai.portion.volume.model.ImageSource;
import com.calai.portion.volume.model.ReferenceObject;
import com.calai.portion.volume.telemetry.EstimationTelemetry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 偵測模型 + 固定 catalog：
 * - catalog 沒有的 label 丟掉（實際尺寸未知就無法換算）
 * - score <= minConfidence 丟掉
 * - 依 confidence 由高到低
 */
@Slf4j
public class CatalogReferenceObjectDetector implements ReferenceObjectDetector {

    private final LazyModel<ReferenceDetectionModel> model;
    private final double minConfidence;
    private final EstimationTelemetry telemetry;

    public CatalogReferenceObjectDetector(LazyModel<ReferenceDetectionModel> model, double minConfidence,
                                          EstimationTelemetry telemetry) {
        this.model = model;
        this.minConfidence = minConfidence;
        this.telemetry = telemetry;
    }

    @Override
    public List<ReferenceObject> detect(ImageSource image) {
        ReferenceDetectionModel m;
        try {
            m = model.get();
        } catch (ModelUnavailableException e) {
            log.debug("reference model unavailable: {}", e.getMessage());
            return List.of();
        }

        List<ReferenceDetectionModel.Detection> raw;
        try {
            raw = m.detect(image);
        } catch (Exception e) {
            telemetry.evidenceFailed("REFERENCE", m.backendCode(), image == null ? null : image.imageId(), e.toString());
            return List.of();
        }
        if (raw == null || raw.isEmpty()) return List.of();

        List<ReferenceObject> out = new ArrayList<>(raw.size());
        for (ReferenceDetectionModel.Detection d : raw) {
            if (d == null) continue;
            double score = clamp01(d.score());
            if (score <= minConfidence) continue;

            Optional<ReferenceObjectCatalog> known = ReferenceObjectCatalog.byLabel(d.label());
            if (known.isEmpty()) continue;

            ReferenceObject ro = new ReferenceObject(
                    known.get().displayName(),
                    known.get().realWorldSize(),
                    new ReferenceObject.PixelSize(d.pixelWidth(), d.pixelHeight()),
                    score
            );
            if (ro.usable()) out.add(ro);
        }

        out.sort(Comparator.comparingDouble(ReferenceObject::confidence).reversed());
        return List.copyOf(out);
    }

    private static double clamp01(double v) {
        if (!Double.isFinite(v) || v < 0) return 0.0;
        return Math.min(v, 1.0);
    }
}

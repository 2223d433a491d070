package com.calai.portion.volume.depth;

import com.calai.portion.volume.inference.LazyModel;
import com.calai.portion.volume.inference.ModelUnavailableException;
import com.calai.portion.volume.model.BoundingBox;
import com.calai.portion.volume.model.DepthEstimate;
import com.calai.portion.volume.model.ImageSource;
import com.calai.portion.volume.telemetry.EstimationTelemetry;
import lombok.extern.slf4j.Slf4j;

/**
 * 跑深度模型，再把 bounding box 範圍內的深度取平均 / 變異數。
 * <p>
 * 深度圖解析度通常和原圖不同：先把 box 換算到深度圖座標再裁切。
 */
@Slf4j
public class ModelDepthEstimator implements DepthEstimator {

    private final LazyModel<DepthModel> model;
    private final double minConfidence;
    private final EstimationTelemetry telemetry;

    public ModelDepthEstimator(LazyModel<DepthModel> model, double minConfidence, EstimationTelemetry telemetry) {
        this.model = model;
        this.minConfidence = minConfidence;
        this.telemetry = telemetry;
    }

    @Override
    public DepthEstimate estimate(ImageSource image, BoundingBox box) {
        DepthModel m;
        try {
            m = model.get();
        } catch (ModelUnavailableException e) {
            log.debug("depth model unavailable: {}", e.getMessage());
            return DepthEstimate.none();
        }

        DepthMap map;
        try {
            map = m.infer(image);
        } catch (Exception e) {
            telemetry.evidenceFailed("DEPTH", m.backendCode(), image == null ? null : image.imageId(), e.toString());
            return DepthEstimate.none();
        }

        if (map == null || !(map.confidence() >= minConfidence)) {
            return DepthEstimate.none();
        }
        return summarize(map, image, box);
    }

    static DepthEstimate summarize(DepthMap map, ImageSource image, BoundingBox box) {
        int imgW = (image != null && image.width() > 0) ? image.width() : map.width();
        int imgH = (image != null && image.height() > 0) ? image.height() : map.height();

        double sx = (double) map.width() / imgW;
        double sy = (double) map.height() / imgH;

        int x0 = clamp((int) Math.floor(box.x() * sx), map.width());
        int y0 = clamp((int) Math.floor(box.y() * sy), map.height());
        int x1 = clamp((int) Math.ceil((box.x() + box.width()) * sx), map.width());
        int y1 = clamp((int) Math.ceil((box.y() + box.height()) * sy), map.height());

        if (x1 <= x0 || y1 <= y0) return DepthEstimate.none(); // box 完全在圖外

        // Welford：一次掃描算平均與變異數
        long n = 0;
        double mean = 0.0;
        double m2 = 0.0;
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                float d = map.at(x, y);
                if (!Float.isFinite(d) || d <= 0f) continue;
                n++;
                double delta = d - mean;
                mean += delta / n;
                m2 += delta * (d - mean);
            }
        }

        if (n == 0 || !Double.isFinite(mean)) return DepthEstimate.none();
        return DepthEstimate.of(mean, m2 / n);
    }

    private static int clamp(int v, int max) {
        if (v < 0) return 0;
        return Math.min(v, max);
    }
}

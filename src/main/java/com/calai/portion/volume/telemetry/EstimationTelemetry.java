package com.calai.portion.volume.telemetry;

import com.calai.portion.volume.model.FoodCategory;
import com.calai.portion.volume.model.VolumeEstimationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class EstimationTelemetry {

    public void estimated(VolumeEstimationResult r, FoodCategory category, String imageId,
                          int referenceCandidates, boolean depthAvailable, long latencyMs) {
        log.info("volume_estimate method={} food={} category={} imageId={} confidence={} volumeMl={} weightG={} shape={} refCandidates={} depth={} latencyMs={}",
                r.method().code(), safe(r.foodName()), category == null ? "NA" : category.code(), safe(imageId),
                String.format("%.3f", r.confidence()), r.estimatedVolume(), r.estimatedWeight(),
                r.shapeAnalysis().shape().code(), referenceCandidates, depthAvailable, latencyMs);
    }

    // ✅ 含 backend：模型推論本身失敗（偵測器 / 深度估計器呼叫）
    public void evidenceFailed(String source, String backend, String imageId, String reason) {
        log.warn("volume_evidence source={} status=FAIL backend={} imageId={} reason={}",
                safe(source), safe(backend), safe(imageId), safe(reason));
    }

    // orchestrator 端：timeout / rejected / 例外，不知道 backend
    public void evidenceFailed(String source, String imageId, String reason) {
        evidenceFailed(source, null, imageId, reason);
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}

package com.calai.portion.volume.density;

import com.calai.portion.volume.config.VolumeEstimationProperties;
import com.calai.portion.volume.model.FoodDensityEntry;
import com.calai.portion.volume.model.FoodShape;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 啟動時建立密度表：
 * 1) 讀 seed JSON（app.volume.density.seed-location）
 * 2) 套用 app.volume.density.overrides（覆寫既有欄位或新增食物）
 * seed 讀不到是設定錯誤，直接讓啟動失敗。
 */
@Slf4j
public class FoodDensitySeedLoader {

    private final ObjectMapper om;
    private final ResourceLoader resourceLoader;

    public FoodDensitySeedLoader(ObjectMapper om, ResourceLoader resourceLoader) {
        this.om = om;
        this.resourceLoader = resourceLoader;
    }

    public Map<String, FoodDensityEntry> load(VolumeEstimationProperties.Density cfg) {
        Map<String, FoodDensityEntry> out = readSeed(cfg.getSeedLocation());
        applyOverrides(out, cfg.getOverrides());
        log.info("Food density table seeded. location={}, entries={}, overrides={}",
                cfg.getSeedLocation(), out.size(),
                cfg.getOverrides() == null ? 0 : cfg.getOverrides().size());
        return out;
    }

    Map<String, FoodDensityEntry> readSeed(String location) {
        Resource res = resourceLoader.getResource(location);
        if (!res.exists()) throw new IllegalStateException("DENSITY_SEED_UNREADABLE: " + location);

        Map<String, FoodDensityEntry> out = new LinkedHashMap<>();
        try (InputStream in = res.getInputStream()) {
            JsonNode root = om.readTree(in);
            JsonNode foods = root.path("foods");
            if (!foods.isObject()) throw new IllegalStateException("DENSITY_SEED_UNREADABLE: foods missing");

            var it = foods.fields();
            while (it.hasNext()) {
                var e = it.next();
                out.put(e.getKey(), toEntry(e.getKey(), e.getValue()));
            }
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("DENSITY_SEED_UNREADABLE: " + location, e);
        }
        return out;
    }

    private static FoodDensityEntry toEntry(String name, JsonNode n) {
        JsonNode density = n.get("density");
        if (density == null || !density.isNumber()) {
            throw new IllegalStateException("DENSITY_SEED_INVALID: " + name + " density missing");
        }
        try {
            return new FoodDensityEntry(
                    density.asDouble(),
                    n.path("variance").asDouble(0.0),
                    FoodShape.parseOrNull(n.path("shape").asText(null)),
                    n.path("compressibility").asDouble(FoodDensityEntry.DEFAULT.compressibility())
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("DENSITY_SEED_INVALID: " + name + " " + e.getMessage(), e);
        }
    }

    static void applyOverrides(Map<String, FoodDensityEntry> target,
                               Map<String, VolumeEstimationProperties.DensityOverride> overrides) {
        if (overrides == null || overrides.isEmpty()) return;

        for (var e : overrides.entrySet()) {
            String name = e.getKey();
            VolumeEstimationProperties.DensityOverride o = e.getValue();
            if (o == null) continue;

            FoodDensityEntry base = findIgnoringCase(target, name);
            if (base == null) base = FoodDensityEntry.DEFAULT;

            FoodShape shape = FoodShape.parseOrNull(o.getShape());
            FoodDensityEntry merged = new FoodDensityEntry(
                    o.getDensity() != null ? o.getDensity() : base.density(),
                    o.getDensityVariance() != null ? o.getDensityVariance() : base.densityVariance(),
                    shape != null ? shape : base.shapePrior(),
                    o.getCompressibility() != null ? o.getCompressibility() : base.compressibility()
            );

            removeIgnoringCase(target, name);
            target.put(name, merged);
        }
    }

    private static FoodDensityEntry findIgnoringCase(Map<String, FoodDensityEntry> m, String name) {
        String key = FoodNameNormalizer.normalize(name);
        for (var e : m.entrySet()) {
            if (FoodNameNormalizer.normalize(e.getKey()).equals(key)) return e.getValue();
        }
        return null;
    }

    private static void removeIgnoringCase(Map<String, FoodDensityEntry> m, String name) {
        String key = FoodNameNormalizer.normalize(name);
        m.keySet().removeIf(k -> FoodNameNormalizer.normalize(k).equals(key));
    }
}

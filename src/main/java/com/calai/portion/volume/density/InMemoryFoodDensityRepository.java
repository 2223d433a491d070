package com.calai.portion.volume.density;

import com.calai.portion.volume.model.FoodDensityEntry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * ConcurrentHashMap + immutable record：
 * - 讀不加鎖
 * - 寫用 compute 做整筆替換（同一個 key 的 read-modify-write 是原子的）
 */
public class InMemoryFoodDensityRepository implements FoodDensityRepository {

    private final ConcurrentHashMap<String, FoodDensityEntry> map = new ConcurrentHashMap<>();

    public InMemoryFoodDensityRepository() {
    }

    public InMemoryFoodDensityRepository(Map<String, FoodDensityEntry> seed) {
        if (seed != null) seed.forEach(this::upsert);
    }

    @Override
    public FoodDensityEntry lookup(String foodName) {
        return find(foodName).orElse(FoodDensityEntry.DEFAULT);
    }

    @Override
    public Optional<FoodDensityEntry> find(String foodName) {
        String key = FoodNameNormalizer.normalize(foodName);
        if (key.isEmpty()) return Optional.empty();
        return Optional.ofNullable(map.get(key));
    }

    @Override
    public void upsert(String foodName, FoodDensityEntry entry) {
        if (entry == null) throw new IllegalArgumentException("DENSITY_ENTRY_REQUIRED");
        map.put(requireKey(foodName), entry);
    }

    @Override
    public FoodDensityEntry update(String foodName, UnaryOperator<FoodDensityEntry> fn) {
        if (fn == null) throw new IllegalArgumentException("DENSITY_UPDATE_REQUIRED");
        return map.compute(requireKey(foodName), (k, cur) -> {
            FoodDensityEntry next = fn.apply(cur == null ? FoodDensityEntry.DEFAULT : cur);
            if (next == null) throw new IllegalStateException("DENSITY_UPDATE_RETURNED_NULL");
            return next;
        });
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public Map<String, FoodDensityEntry> snapshot() {
        return Map.copyOf(map);
    }

    private static String requireKey(String foodName) {
        String key = FoodNameNormalizer.normalize(foodName);
        if (key.isEmpty()) throw new IllegalArgumentException("FOOD_NAME_REQUIRED");
        return key;
    }
}

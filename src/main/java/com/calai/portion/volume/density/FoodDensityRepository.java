package com.calai.portion.volume.density;

import com.calai.portion.volume.model.FoodDensityEntry;

import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 食物名稱 -> 密度資料。
 * <p>
 * 讀（每次估算）可以和單一寫入者（calibration）並行；
 * 實作必須整筆替換，讀取端不能看到只更新一半的 entry。
 */
public interface FoodDensityRepository {

    /** 未知食物回 {@link FoodDensityEntry#DEFAULT}，不丟例外 */
    FoodDensityEntry lookup(String foodName);

    Optional<FoodDensityEntry> find(String foodName);

    void upsert(String foodName, FoodDensityEntry entry);

    /**
     * 原子性 read-modify-write；fn 拿到目前的 entry（未知食物則為 DEFAULT）。
     *
     * @return 寫入後的 entry
     */
    FoodDensityEntry update(String foodName, UnaryOperator<FoodDensityEntry> fn);

    int size();

    /** 唯讀快照（key 為正規化後的名稱） */
    Map<String, FoodDensityEntry> snapshot();
}

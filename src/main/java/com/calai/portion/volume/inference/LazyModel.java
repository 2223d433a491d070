package com.calai.portion.volume.inference;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 昂貴模型的 lazy 載入（整個 process 只載一次）。
 * <ul>
 *   <li>double-checked：READY 之後讀取不加鎖</li>
 *   <li>single-flight：多執行緒同時第一次呼叫，只有一個會真的去 load</li>
 *   <li>載入失敗（Exception 或 LinkageError）記成 UNAVAILABLE，retryAfter 內直接回失敗，不重複打 loader</li>
 * </ul>
 */
@Slf4j
public class LazyModel<T> implements AutoCloseable {

    private final String name;
    private final ModelLoader<T> loader;
    private final Duration retryAfter;
    private final Clock clock;

    private final Object lock = new Object();

    private volatile T model;
    private volatile Instant failedAt;
    private volatile String lastError;

    public LazyModel(String name, ModelLoader<T> loader, Duration retryAfter) {
        this(name, loader, retryAfter, Clock.systemUTC());
    }

    public LazyModel(String name, ModelLoader<T> loader, Duration retryAfter, Clock clock) {
        if (loader == null) throw new IllegalArgumentException("MODEL_LOADER_REQUIRED");
        this.name = name;
        this.loader = loader;
        this.retryAfter = (retryAfter == null || retryAfter.isNegative()) ? Duration.ZERO : retryAfter;
        this.clock = clock;
    }

    public T get() throws ModelUnavailableException {
        T m = model;
        if (m != null) return m;

        synchronized (lock) {
            if (model != null) return model;

            Instant now = clock.instant();
            if (failedAt != null && now.isBefore(failedAt.plus(retryAfter))) {
                throw new ModelUnavailableException("MODEL_UNAVAILABLE: " + name + " (" + lastError + ")");
            }

            long t0 = System.nanoTime();
            try {
                T loaded = loader.load();
                if (loaded == null) throw new IllegalStateException("MODEL_LOADER_RETURNED_NULL");
                model = loaded;
                failedAt = null;
                lastError = null;
                log.info("model_load status=OK model={} latencyMs={}", name, (System.nanoTime() - t0) / 1_000_000);
                return loaded;
            } catch (Exception | LinkageError e) {
                // native lib 缺失 / class 初始化失敗也算載入失敗，一樣進冷卻期
                failedAt = now;
                lastError = (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("model_load status=FAIL model={} latencyMs={} error={} retryAfter={}",
                        name, (System.nanoTime() - t0) / 1_000_000, lastError, retryAfter);
                throw new ModelUnavailableException("MODEL_UNAVAILABLE: " + name, e);
            }
        }
    }

    public ModelState state() {
        if (model != null) return ModelState.READY;
        return (failedAt != null) ? ModelState.UNAVAILABLE : ModelState.NOT_LOADED;
    }

    public String name() {
        return name;
    }

    public String lastError() {
        return lastError;
    }

    /**
     * 釋放模型；之後的 get() 會重新載入。
     */
    @Override
    public void close() {
        T m;
        synchronized (lock) {
            m = model;
            model = null;
            failedAt = null;
            lastError = null;
        }
        if (m instanceof AutoCloseable c) {
            try {
                c.close();
                log.info("model_close status=OK model={}", name);
            } catch (Exception e) {
                log.warn("model_close status=FAIL model={} error={}", name, e.toString());
            }
        }
    }
}

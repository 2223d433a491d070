package com.calai.portion.volume.inference;

@FunctionalInterface
public interface ModelLoader<T> {

    T load() throws Exception;
}

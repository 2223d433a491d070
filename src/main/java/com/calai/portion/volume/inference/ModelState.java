package com.calai.portion.volume.inference;

public enum ModelState {
    NOT_LOADED,
    READY,
    UNAVAILABLE
}

package com.filefinder.index;

public enum IndexMode {
    FULL,
    INCREMENTAL
}

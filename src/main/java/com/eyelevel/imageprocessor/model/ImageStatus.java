package com.eyelevel.imageprocessor.model;

public enum ImageStatus {
    EXTRACTED,
    RENAMED,
    ACCEPTED,
    REJECTED,
    CONVERTED,
    FAILED
}

package com.propplatform.common.model;

public enum VenueType {
    OUTDOOR,
    INDOOR
}

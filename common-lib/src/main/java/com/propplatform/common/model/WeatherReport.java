package com.propplatform.common.model;

public record WeatherReport(
    double temperatureF,
    double windMph,
    VenueType venue
) {}

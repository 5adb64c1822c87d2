package com.ryuqq.dispatcher.core.model;

/**
 * 공간 서브세팅 영역 (WGS84 경위도).
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record BoundingBox(
    double west,
    double south,
    double east,
    double north
) {

    public BoundingBox {
        if (south > north) {
            throw new IllegalArgumentException("south must not exceed north (south: " + south + ", north: " + north + ")");
        }
        if (south < -90 || north > 90) {
            throw new IllegalArgumentException("latitude out of range (south: " + south + ", north: " + north + ")");
        }
        if (west < -180 || west > 180 || east < -180 || east > 180) {
            throw new IllegalArgumentException("longitude out of range (west: " + west + ", east: " + east + ")");
        }
    }

    public static BoundingBox of(double west, double south, double east, double north) {
        return new BoundingBox(west, south, east, north);
    }
}

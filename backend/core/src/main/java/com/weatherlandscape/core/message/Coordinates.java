package com.weatherlandscape.core.message;

final class Coordinates {
    private Coordinates() {
    }

    static void check(double lat, double lon) {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("Latitude out of range: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180 || lon > 180) {
            throw new IllegalArgumentException("Longitude out of range: " + lon);
        }
    }
}

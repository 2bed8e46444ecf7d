package com.example.evcharging.service;

import com.example.evcharging.model.Station;

final class GeoDistance {

    private static final double EARTH_RADIUS_KM = 6371.0088;

    private GeoDistance() {
    }

    /**
     * Great-circle distance in kilometres, rounded to metres; null when the station has no
     * coordinates.
     */
    static Double kilometres(double latitude, double longitude, Station station) {
        if (!station.hasCoordinates()) {
            return null;
        }
        double dLat = Math.toRadians(station.getLatitude() - latitude);
        double dLon = Math.toRadians(station.getLongitude() - longitude);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(station.getLatitude()))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double km = 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return Math.round(km * 1000) / 1000.0;
    }
}

package com.pikdrive.booking.mapper;

import com.pikdrive.booking.dto.RideEntry;
import com.pikdrive.booking.dto.RideRequest;
import com.pikdrive.booking.model.Ride;

public final class RideMapper {

    private RideMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static RideEntry toEntry(Ride ride, int availableSeats) {
        if (ride == null) {
            return null;
        }

        return RideEntry.builder()
                .rideId(ride.getRideId())
                .driverId(ride.getDriverId())
                .fromCity(ride.getFromCity())
                .toCity(ride.getToCity())
                .departureTime(ride.getDepartureTime())
                .pricePerSeat(ride.getPricePerSeat())
                .totalSeats(ride.getTotalSeats())
                .availableSeats(availableSeats)
                .createdAt(ride.getCreatedAt())
                .build();
    }

    public static Ride toEntity(String rideId, RideRequest request) {
        if (request == null) {
            return null;
        }

        return Ride.builder()
                .rideId(rideId)
                .driverId(request.getDriverId())
                .fromCity(request.getFromCity().trim())
                .toCity(request.getToCity().trim())
                .departureTime(request.getDepartureTime())
                .pricePerSeat(request.getPricePerSeat())
                .totalSeats(request.getTotalSeats())
                .committedSeats(0)
                .build();
    }
}

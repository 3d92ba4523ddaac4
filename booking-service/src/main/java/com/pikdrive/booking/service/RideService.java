package com.pikdrive.booking.service;

import com.pikdrive.booking.dto.RideEntry;
import com.pikdrive.booking.dto.RideRequest;
import com.pikdrive.booking.exception.RideNotFoundException;
import com.pikdrive.booking.mapper.RideMapper;
import com.pikdrive.booking.model.Ride;
import com.pikdrive.booking.repository.RideRepository;
import com.pikdrive.booking.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class RideService {

    private final RideRepository rideRepository;
    private final RideInventoryService inventoryService;

    @Transactional
    public RideEntry createRide(RideRequest request) {
        log.info("Creating ride: driver={}, from={}, to={}, seats={}",
                request.getDriverId(), request.getFromCity(), request.getToCity(), request.getTotalSeats());

        Ride ride = rideRepository.save(RideMapper.toEntity(IdGenerator.generateRideId(), request));

        log.info("Ride created: rideId={}", ride.getRideId());
        return RideMapper.toEntry(ride, ride.availableSeats());
    }

    @Transactional(readOnly = true)
    public RideEntry getRide(String rideId) {
        Ride ride = rideRepository.findById(rideId)
                .orElseThrow(() -> new RideNotFoundException(rideId));
        return RideMapper.toEntry(ride, inventoryService.availableSeats(rideId));
    }
}

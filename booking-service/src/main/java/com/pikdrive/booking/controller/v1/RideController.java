package com.pikdrive.booking.controller.v1;

import com.pikdrive.booking.dto.RideEntry;
import com.pikdrive.booking.dto.RideRequest;
import com.pikdrive.booking.service.RideService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/rides")
@RequiredArgsConstructor
@Slf4j
public class RideController {

    private final RideService rideService;

    @PostMapping
    public ResponseEntity<RideEntry> create(@Valid @RequestBody RideRequest request) {
        log.info("POST /v1/rides - driver={}, from={}, to={}",
                request.getDriverId(), request.getFromCity(), request.getToCity());
        return ResponseEntity.status(HttpStatus.CREATED).body(rideService.createRide(request));
    }

    @GetMapping("/{rideId}")
    public ResponseEntity<RideEntry> findById(@PathVariable String rideId) {
        log.debug("GET /v1/rides/{}", rideId);
        return ResponseEntity.ok(rideService.getRide(rideId));
    }
}

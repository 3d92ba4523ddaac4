package com.pikdrive.booking.mapper;

import com.pikdrive.booking.dto.BookingEntry;
import com.pikdrive.booking.model.Booking;

import java.util.ArrayList;
import java.util.List;

public final class BookingMapper {

    private BookingMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static BookingEntry toEntry(Booking booking) {
        if (booking == null) {
            return null;
        }

        return BookingEntry.builder()
                .bookingId(booking.getBookingId())
                .rideId(booking.getRideId())
                .riderId(booking.getRiderId())
                .seats(booking.getSeats())
                .paidSeats(booking.getPaidSeats())
                .unpaidSeats(booking.unpaidSeats())
                .paymentStatus(booking.getPaymentStatus() != null ? booking.getPaymentStatus().name() : null)
                .verificationCode(booking.getVerificationCode())
                .codeVerified(booking.getCodeVerified())
                .createdAt(booking.getCreatedAt())
                .updatedAt(booking.getUpdatedAt())
                .build();
    }

    public static List<BookingEntry> toEntryList(List<Booking> bookings) {
        if (bookings == null || bookings.isEmpty()) {
            return new ArrayList<>();
        }

        List<BookingEntry> result = new ArrayList<>(bookings.size());
        for (Booking booking : bookings) {
            result.add(toEntry(booking));
        }
        return result;
    }
}

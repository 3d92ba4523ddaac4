package com.pikdrive.booking.service;

import com.pikdrive.booking.constants.BookingConstants;
import com.pikdrive.booking.dto.VerificationResult;
import com.pikdrive.booking.enums.BookingPaymentStatus;
import com.pikdrive.booking.exception.BookingNotFoundException;
import com.pikdrive.booking.model.Booking;
import com.pikdrive.booking.repository.BookingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.LocalDateTime;

/**
 * Boarding codes. A rider gets a fresh code each time a payment completes and
 * the driver checks it at pickup.
 */
@Service
@Slf4j
public class BookingVerificationService {

    private static final int CODE_BOUND = 1_000_000;

    private final BookingRepository bookingRepository;
    private final SecureRandom random = new SecureRandom();
    private final int codeTtlHours;

    public BookingVerificationService(
            BookingRepository bookingRepository,
            @Value("${booking.verification-code-ttl-hours:" + BookingConstants.DEFAULT_VERIFICATION_CODE_TTL_HOURS + "}") int codeTtlHours) {
        this.bookingRepository = bookingRepository;
        this.codeTtlHours = codeTtlHours;
    }

    /**
     * Sets a new code on the booking. Persisted by the caller's transaction.
     */
    public void issueCode(Booking booking) {
        String code = String.format("%0" + BookingConstants.VERIFICATION_CODE_LENGTH + "d", random.nextInt(CODE_BOUND));
        booking.setVerificationCode(code);
        booking.setCodeExpiresAt(LocalDateTime.now().plusHours(codeTtlHours));
        booking.setCodeVerified(false);
        log.debug("Verification code issued: bookingId={}", booking.getBookingId());
    }

    @Transactional
    public VerificationResult verifyCode(String bookingId, String code) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (booking.getPaymentStatus() != BookingPaymentStatus.COMPLETED || booking.getVerificationCode() == null) {
            log.warn("Verification refused, booking not paid: id={}, status={}", bookingId, booking.getPaymentStatus());
            return new VerificationResult(bookingId, false);
        }
        if (Boolean.TRUE.equals(booking.getCodeVerified())) {
            log.warn("Verification code already used: id={}", bookingId);
            return new VerificationResult(bookingId, false);
        }
        if (booking.getCodeExpiresAt() != null && booking.getCodeExpiresAt().isBefore(LocalDateTime.now())) {
            log.warn("Verification code expired: id={}", bookingId);
            return new VerificationResult(bookingId, false);
        }

        boolean matches = code != null && MessageDigest.isEqual(
                booking.getVerificationCode().getBytes(StandardCharsets.UTF_8),
                code.trim().getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            log.warn("Verification code mismatch: id={}", bookingId);
            return new VerificationResult(bookingId, false);
        }

        booking.setCodeVerified(true);
        bookingRepository.save(booking);
        log.info("Booking verified: id={}", bookingId);
        return new VerificationResult(bookingId, true);
    }
}

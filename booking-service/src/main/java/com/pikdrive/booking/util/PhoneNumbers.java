package com.pikdrive.booking.util;

import com.pikdrive.booking.constants.PaymentConstants;

import java.util.Optional;

public final class PhoneNumbers {

    private static final int VISIBLE_DIGITS = 3;

    private PhoneNumbers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Reduces a Cameroonian number to its 9-digit national form. Accepts
     * separators and an optional {@code +237}/{@code 237} prefix.
     */
    public static Optional<String> toNationalNumber(String phoneNumber) {
        if (phoneNumber == null) {
            return Optional.empty();
        }
        String digits = phoneNumber.replaceAll("\\D", "");
        if (digits.length() == PaymentConstants.CAMEROON_CALLING_CODE.length() + PaymentConstants.NATIONAL_NUMBER_LENGTH
                && digits.startsWith(PaymentConstants.CAMEROON_CALLING_CODE)) {
            digits = digits.substring(PaymentConstants.CAMEROON_CALLING_CODE.length());
        }
        return digits.length() == PaymentConstants.NATIONAL_NUMBER_LENGTH ? Optional.of(digits) : Optional.empty();
    }

    public static String toInternational(String nationalNumber) {
        return PaymentConstants.CAMEROON_CALLING_CODE + nationalNumber;
    }

    /**
     * Masks all but the last digits, for log lines and API responses.
     */
    public static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() <= VISIBLE_DIGITS) {
            return "***";
        }
        return "*".repeat(phoneNumber.length() - VISIBLE_DIGITS)
                + phoneNumber.substring(phoneNumber.length() - VISIBLE_DIGITS);
    }
}

package com.pikdrive.booking.dto;

import com.pikdrive.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentRequest {

    @NotBlank(message = ValidationMessages.PROVIDER_REQUIRED)
    String provider;

    @NotBlank(message = ValidationMessages.PHONE_NUMBER_REQUIRED)
    String phoneNumber;
}

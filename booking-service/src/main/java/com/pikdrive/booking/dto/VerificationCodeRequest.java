package com.pikdrive.booking.dto;

import com.pikdrive.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class VerificationCodeRequest {

    @NotBlank(message = ValidationMessages.VERIFICATION_CODE_REQUIRED)
    String code;
}

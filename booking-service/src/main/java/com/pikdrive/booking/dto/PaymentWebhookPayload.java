package com.pikdrive.booking.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Status notification pushed by a provider. MTN sends {@code referenceId} and
 * echoes our transaction id as {@code externalId}; Orange sends {@code payToken}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentWebhookPayload {

    @JsonAlias({"referenceId", "payToken"})
    String reference;

    String externalId;

    String status;

    String reason;
}

package com.pikdrive.booking.client;

import lombok.Value;

/**
 * Identifier a provider knows the transaction by. Used for status queries and
 * to match incoming notifications.
 */
@Value
public class ExternalTransactionRef {

    String reference;
}

package com.pikdrive.booking.repository;

import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.enums.TransactionStatus;
import com.pikdrive.booking.model.PaymentTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, String> {

    Optional<PaymentTransaction> findByActiveBookingId(String bookingId);

    boolean existsByActiveBookingId(String bookingId);

    Optional<PaymentTransaction> findFirstByBookingIdOrderByCreatedAtDesc(String bookingId);

    Optional<PaymentTransaction> findByProviderAndExternalReference(PaymentProvider provider, String externalReference);

    List<PaymentTransaction> findByStatusIn(Collection<TransactionStatus> statuses);

    /**
     * Moves an active transaction to a terminal status. Returns 0 when the
     * transaction was already terminal, which makes the caller a no-op.
     */
    @Modifying
    @Query("UPDATE PaymentTransaction t SET t.status = :terminal, t.activeBookingId = NULL, " +
            "t.failureReason = :reason, t.resolvedAt = :resolvedAt, t.updatedAt = :resolvedAt, " +
            "t.version = t.version + 1 " +
            "WHERE t.transactionId = :transactionId AND t.status IN :activeStatuses")
    int markTerminal(@Param("transactionId") String transactionId,
                     @Param("terminal") TransactionStatus terminal,
                     @Param("reason") String reason,
                     @Param("resolvedAt") LocalDateTime resolvedAt,
                     @Param("activeStatuses") Collection<TransactionStatus> activeStatuses);
}

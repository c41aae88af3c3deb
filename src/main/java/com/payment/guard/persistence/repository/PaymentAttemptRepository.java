package com.payment.guard.persistence.repository;

import com.payment.guard.domain.AttemptStatus;
import com.payment.guard.persistence.entity.PaymentAttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for payment attempt history.
 */
@Repository
public interface PaymentAttemptRepository extends JpaRepository<PaymentAttemptEntity, String> {

    @Query("SELECT a FROM PaymentAttemptEntity a WHERE a.userId = :userId AND a.createdAt >= :since ORDER BY a.createdAt DESC")
    List<PaymentAttemptEntity> findRecentByUser(@Param("userId") String userId, @Param("since") Instant since);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE PaymentAttemptEntity a SET a.status = :status, a.updatedAt = :updatedAt WHERE a.attemptId = :attemptId")
    int updateStatus(@Param("attemptId") String attemptId,
                     @Param("status") AttemptStatus status,
                     @Param("updatedAt") Instant updatedAt);
}

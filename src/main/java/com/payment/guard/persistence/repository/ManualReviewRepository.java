package com.payment.guard.persistence.repository;

import com.payment.guard.persistence.entity.ManualReviewEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ManualReviewRepository extends JpaRepository<ManualReviewEntity, String> {

    List<ManualReviewEntity> findByStatusOrderByCreatedAtDesc(String status, Pageable pageable);
}

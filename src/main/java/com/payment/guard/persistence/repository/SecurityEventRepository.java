package com.payment.guard.persistence.repository;

import com.payment.guard.persistence.entity.SecurityEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SecurityEventRepository extends JpaRepository<SecurityEventEntity, String> {

    List<SecurityEventEntity> findByOrderByOccurredAtDesc(Pageable pageable);
}

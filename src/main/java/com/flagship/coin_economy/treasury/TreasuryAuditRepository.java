package com.flagship.coin_economy.treasury;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TreasuryAuditRepository extends JpaRepository<TreasuryAuditEntity, UUID> {

    List<TreasuryAuditEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);
}

package com.mouse.odds.repository;

import com.mouse.odds.entity.ArbitrageOpportunityRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ArbitrageOpportunityRepository extends JpaRepository<ArbitrageOpportunityRecord, Long> {

    // === Clean up expired opportunities ===
    @Modifying
    @Transactional
    @Query("""
        DELETE FROM ArbitrageOpportunityRecord a
        WHERE a.expiresAt IS NOT NULL
          AND a.expiresAt < :cutoff
        """)
    int deleteExpired(@Param("cutoff") Instant cutoff);
}

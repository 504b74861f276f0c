package com.mouse.odds.repository;

import com.mouse.odds.entity.OddsSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OddsSnapshotRepository extends JpaRepository<OddsSnapshotRecord, Long> {
}

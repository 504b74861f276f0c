package com.mouse.odds.repository;

import com.mouse.odds.entity.MovementAlertRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MovementAlertRepository extends JpaRepository<MovementAlertRecord, Long> {
}

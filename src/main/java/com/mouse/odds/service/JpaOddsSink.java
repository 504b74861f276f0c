package com.mouse.odds.service;

import com.mouse.odds.converter.RecordConverter;
import com.mouse.odds.entity.ArbitrageOpportunityRecord;
import com.mouse.odds.entity.MovementAlertRecord;
import com.mouse.odds.entity.OddsSnapshotRecord;
import com.mouse.odds.interfaces.OddsSink;
import com.mouse.odds.model.ArbitrageOpportunity;
import com.mouse.odds.model.MovementAlert;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.repository.ArbitrageOpportunityRepository;
import com.mouse.odds.repository.MovementAlertRepository;
import com.mouse.odds.repository.OddsSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaOddsSink implements OddsSink {

    // Expired opportunities are kept this long for after-the-fact review
    private static final Duration EXPIRED_RETENTION = Duration.ofHours(24);

    private final OddsSnapshotRepository oddsSnapshotRepository;
    private final MovementAlertRepository movementAlertRepository;
    private final ArbitrageOpportunityRepository arbitrageOpportunityRepository;
    private final Clock clock;

    @Override
    public void writeOddsSnapshot(OddsSnapshot snapshot) {
        OddsSnapshotRecord saved = oddsSnapshotRepository.save(RecordConverter.fromSnapshot(snapshot));
        log.debug("Stored snapshot id={} fightId={} bookmaker={}", saved.getId(), snapshot.getFightId(), snapshot.getBookmaker());
    }

    @Override
    public void writeMovementAlert(MovementAlert alert) {
        MovementAlertRecord saved = movementAlertRepository.save(RecordConverter.fromAlert(alert));
        log.debug("Stored movement alert id={} fightId={} type={}", saved.getId(), alert.getFightId(), alert.getMovementType());
    }

    @Override
    public void writeArbitrageOpportunity(ArbitrageOpportunity opportunity) {
        ArbitrageOpportunityRecord saved = arbitrageOpportunityRepository.save(RecordConverter.fromOpportunity(opportunity));
        log.debug("Stored arbitrage id={} fightId={} profit={}%", saved.getId(), opportunity.getFightId(), opportunity.getProfitPercentage());
    }

    @Scheduled(fixedDelayString = "${detection.arbitrage.purge-interval:PT1H}")
    public void purgeExpiredOpportunities() {
        int deleted = arbitrageOpportunityRepository.deleteExpired(clock.instant().minus(EXPIRED_RETENTION));
        if (deleted > 0) {
            log.info("Purged {} expired arbitrage opportunities", deleted);
        }
    }
}

package com.mouse.odds.service;

import com.mouse.odds.entity.ArbitrageOpportunityRecord;
import com.mouse.odds.entity.MovementAlertRecord;
import com.mouse.odds.entity.OddsSnapshotRecord;
import com.mouse.odds.enums.MovementType;
import com.mouse.odds.model.ArbitrageOpportunity;
import com.mouse.odds.model.MethodOdds;
import com.mouse.odds.model.MoneylineOdds;
import com.mouse.odds.model.MovementAlert;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.model.RoundOdds;
import com.mouse.odds.repository.ArbitrageOpportunityRepository;
import com.mouse.odds.repository.MovementAlertRepository;
import com.mouse.odds.repository.OddsSnapshotRepository;
import com.mouse.odds.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaOddsSinkTest {

    private static final String FIGHT = "odds_api_Jon_Jones_vs_Stipe_Miocic_2024_07_06";

    @Mock
    private OddsSnapshotRepository oddsSnapshotRepository;
    @Mock
    private MovementAlertRepository movementAlertRepository;
    @Mock
    private ArbitrageOpportunityRepository arbitrageOpportunityRepository;

    private MutableClock clock;
    private JpaOddsSink sink;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-07-01T18:00:00Z");
        sink = new JpaOddsSink(oddsSnapshotRepository, movementAlertRepository, arbitrageOpportunityRepository, clock);
    }

    private OddsSnapshot snapshot(String fighter1, String fighter2) {
        return OddsSnapshot.builder()
                .fightId(FIGHT)
                .bookmaker("DraftKings")
                .timestamp(clock.instant())
                .moneyline(MoneylineOdds.of(new BigDecimal(fighter1), new BigDecimal(fighter2)))
                .method(MethodOdds.builder().koTko(new BigDecimal("150")).submission(BigDecimal.ZERO).decision(new BigDecimal("400")).build())
                .rounds(RoundOdds.unknown())
                .build();
    }

    @Test
    void writeOddsSnapshot_flattensAllMarkets() {
        when(oddsSnapshotRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        sink.writeOddsSnapshot(snapshot("-250", "210"));

        ArgumentCaptor<OddsSnapshotRecord> captor = ArgumentCaptor.forClass(OddsSnapshotRecord.class);
        verify(oddsSnapshotRepository).save(captor.capture());
        OddsSnapshotRecord record = captor.getValue();
        assertThat(record.getFightId()).isEqualTo(FIGHT);
        assertThat(record.getBookmaker()).isEqualTo("DraftKings");
        assertThat(record.getCapturedAt()).isEqualTo(clock.instant());
        assertThat(record.getFighter1Odds()).isEqualByComparingTo("-250");
        assertThat(record.getFighter2Odds()).isEqualByComparingTo("210");
        assertThat(record.getKoTkoOdds()).isEqualByComparingTo("150");
        assertThat(record.getDecisionOdds()).isEqualByComparingTo("400");
        assertThat(record.getRound1Odds()).isEqualByComparingTo("0");
        assertThat(record.getRound4Odds()).isNull();
    }

    @Test
    void writeMovementAlert_keepsBothMoneylines() {
        when(movementAlertRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        MovementAlert alert = MovementAlert.builder()
                .fightId(FIGHT)
                .bookmaker("DraftKings")
                .movementType(MovementType.STEAM)
                .oldOdds(snapshot("-150", "130"))
                .newOdds(snapshot("-180", "110"))
                .fighter1Change(new BigDecimal("-20.0000"))
                .fighter2Change(new BigDecimal("-15.3846"))
                .percentageChange(new BigDecimal("20.0000"))
                .timestamp(clock.instant())
                .build();

        sink.writeMovementAlert(alert);

        ArgumentCaptor<MovementAlertRecord> captor = ArgumentCaptor.forClass(MovementAlertRecord.class);
        verify(movementAlertRepository).save(captor.capture());
        MovementAlertRecord record = captor.getValue();
        assertThat(record.getMovementType()).isEqualTo(MovementType.STEAM);
        assertThat(record.getOldFighter1Odds()).isEqualByComparingTo("-150");
        assertThat(record.getNewFighter2Odds()).isEqualByComparingTo("110");
        assertThat(record.getPercentageChange()).isEqualByComparingTo("20");
        assertThat(record.getDetectedAt()).isEqualTo(clock.instant());
    }

    @Test
    void writeArbitrageOpportunity_storesStakesAndExpiry() {
        when(arbitrageOpportunityRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        Instant now = clock.instant();
        ArbitrageOpportunity opportunity = ArbitrageOpportunity.builder()
                .fightId(FIGHT)
                .bookmaker("DraftKings")
                .bookmaker("FanDuel")
                .fighter1Odds(new BigDecimal("120"))
                .fighter2Odds(new BigDecimal("120"))
                .totalImpliedProbability(new BigDecimal("0.9091"))
                .profitPercentage(new BigDecimal("10.0000"))
                .totalStake(new BigDecimal("1000"))
                .stake("DraftKings", new BigDecimal("500.00"))
                .stake("FanDuel", new BigDecimal("500.00"))
                .detectedAt(now)
                .expiresAt(now.plusSeconds(900))
                .build();

        sink.writeArbitrageOpportunity(opportunity);

        ArgumentCaptor<ArbitrageOpportunityRecord> captor = ArgumentCaptor.forClass(ArbitrageOpportunityRecord.class);
        verify(arbitrageOpportunityRepository).save(captor.capture());
        ArbitrageOpportunityRecord record = captor.getValue();
        assertThat(record.getBookmakers()).containsExactly("DraftKings", "FanDuel");
        assertThat(record.getStakes()).containsEntry("FanDuel", new BigDecimal("500.00"));
        assertThat(record.getExpiresAt()).isEqualTo(now.plusSeconds(900));
    }

    @Test
    void purgeExpiredOpportunities_keepsOneDayOfHistory() {
        when(arbitrageOpportunityRepository.deleteExpired(any())).thenReturn(3);

        sink.purgeExpiredOpportunities();

        verify(arbitrageOpportunityRepository).deleteExpired(Instant.parse("2024-06-30T18:00:00Z"));
    }
}

package com.mouse.odds.converter;

import com.mouse.odds.entity.ArbitrageOpportunityRecord;
import com.mouse.odds.entity.MovementAlertRecord;
import com.mouse.odds.entity.OddsSnapshotRecord;
import com.mouse.odds.model.ArbitrageOpportunity;
import com.mouse.odds.model.MethodOdds;
import com.mouse.odds.model.MoneylineOdds;
import com.mouse.odds.model.MovementAlert;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.model.RoundOdds;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Domain model to JPA record mapping.
 */
public class RecordConverter {

    public static OddsSnapshotRecord fromSnapshot(OddsSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        MoneylineOdds moneyline = snapshot.getMoneyline();
        MethodOdds method = snapshot.getMethod() != null ? snapshot.getMethod() : MethodOdds.unknown();
        RoundOdds rounds = snapshot.getRounds() != null ? snapshot.getRounds() : RoundOdds.unknown();

        return OddsSnapshotRecord.builder()
                .fightId(snapshot.getFightId())
                .bookmaker(snapshot.getBookmaker())
                .capturedAt(snapshot.getTimestamp())
                .fighter1Odds(moneyline != null ? moneyline.getFighter1() : null)
                .fighter2Odds(moneyline != null ? moneyline.getFighter2() : null)
                .koTkoOdds(method.getKoTko())
                .submissionOdds(method.getSubmission())
                .decisionOdds(method.getDecision())
                .round1Odds(rounds.getRound1())
                .round2Odds(rounds.getRound2())
                .round3Odds(rounds.getRound3())
                .round4Odds(rounds.getRound4())
                .round5Odds(rounds.getRound5())
                .build();
    }

    public static OddsSnapshot toSnapshot(OddsSnapshotRecord record) {
        return OddsSnapshot.builder()
                .fightId(record.getFightId())
                .bookmaker(record.getBookmaker())
                .timestamp(record.getCapturedAt())
                .moneyline(MoneylineOdds.of(record.getFighter1Odds(), record.getFighter2Odds()))
                .method(MethodOdds.builder()
                        .koTko(record.getKoTkoOdds())
                        .submission(record.getSubmissionOdds())
                        .decision(record.getDecisionOdds())
                        .build())
                .rounds(RoundOdds.builder()
                        .round1(record.getRound1Odds())
                        .round2(record.getRound2Odds())
                        .round3(record.getRound3Odds())
                        .round4(record.getRound4Odds())
                        .round5(record.getRound5Odds())
                        .build())
                .build();
    }

    public static MovementAlertRecord fromAlert(MovementAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");

        MoneylineOdds oldLine = alert.getOldOdds() != null ? alert.getOldOdds().getMoneyline() : null;
        MoneylineOdds newLine = alert.getNewOdds() != null ? alert.getNewOdds().getMoneyline() : null;

        return MovementAlertRecord.builder()
                .fightId(alert.getFightId())
                .bookmaker(alert.getBookmaker())
                .movementType(alert.getMovementType())
                .oldFighter1Odds(oldLine != null ? oldLine.getFighter1() : null)
                .oldFighter2Odds(oldLine != null ? oldLine.getFighter2() : null)
                .newFighter1Odds(newLine != null ? newLine.getFighter1() : null)
                .newFighter2Odds(newLine != null ? newLine.getFighter2() : null)
                .fighter1Change(alert.getFighter1Change())
                .fighter2Change(alert.getFighter2Change())
                .percentageChange(alert.getPercentageChange())
                .detectedAt(alert.getTimestamp())
                .build();
    }

    public static ArbitrageOpportunityRecord fromOpportunity(ArbitrageOpportunity opportunity) {
        Objects.requireNonNull(opportunity, "opportunity must not be null");

        return ArbitrageOpportunityRecord.builder()
                .fightId(opportunity.getFightId())
                .bookmakers(new ArrayList<>(opportunity.getBookmakers()))
                .fighter1Odds(opportunity.getFighter1Odds())
                .fighter2Odds(opportunity.getFighter2Odds())
                .totalImpliedProbability(opportunity.getTotalImpliedProbability())
                .profitPercentage(opportunity.getProfitPercentage())
                .totalStake(opportunity.getTotalStake())
                .stakes(new LinkedHashMap<>(opportunity.getStakes()))
                .detectedAt(opportunity.getDetectedAt())
                .expiresAt(opportunity.getExpiresAt())
                .build();
    }
}

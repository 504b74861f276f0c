package com.mouse.odds.interfaces;

import com.mouse.odds.model.ArbitrageOpportunity;
import com.mouse.odds.model.MovementAlert;
import com.mouse.odds.model.OddsSnapshot;

public interface OddsSink {

    void writeOddsSnapshot(OddsSnapshot snapshot);

    void writeMovementAlert(MovementAlert alert);

    void writeArbitrageOpportunity(ArbitrageOpportunity opportunity);
}

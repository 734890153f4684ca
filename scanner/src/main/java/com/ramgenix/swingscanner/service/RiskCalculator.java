package com.ramgenix.swingscanner.service;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.Setup;

/**
 * Entry, stop and target for every engine: entry just above the trigger high, stop a fraction of ATR under the
 * structural level, target at a fixed reward multiple of the risk.
 */
@Service
public class RiskCalculator {

	private final ScannerProperties.Risk config;

	public RiskCalculator(ScannerProperties properties) {
		this.config = properties.getRisk();
	}

	/**
	 * @param triggerHigh high the entry is placed above
	 * @param stopBase    structural level the stop hangs under
	 * @param atr         current average true range
	 * @return the plan, or empty when the risk is not positive or exceeds the allowed fraction of entry
	 */
	public Optional<RiskPlan> plan(double triggerHigh, double stopBase, double atr) {
		double entry = triggerHigh * config.getEntryFactor();
		double stopLoss = stopBase - config.getStopAtrFraction() * atr;
		double risk = entry - stopLoss;
		if (!Double.isFinite(risk) || risk <= 0 || risk > entry * config.getMaxRiskFraction()) {
			return Optional.empty();
		}
		double takeProfit = entry + config.getRewardMultiple() * risk;
		return Optional.of(new RiskPlan(entry, stopLoss, takeProfit, config.getRewardMultiple()));
	}

	public static final class RiskPlan {
		private final double entry;
		private final double stopLoss;
		private final double takeProfit;
		private final double riskReward;

		RiskPlan(double entry, double stopLoss, double takeProfit, double riskReward) {
			this.entry = entry;
			this.stopLoss = stopLoss;
			this.takeProfit = takeProfit;
			this.riskReward = riskReward;
		}

		public double getEntry() {
			return entry;
		}

		public double getStopLoss() {
			return stopLoss;
		}

		public double getTakeProfit() {
			return takeProfit;
		}

		public double getRiskReward() {
			return riskReward;
		}

		public Setup.SetupBuilder applyTo(Setup.SetupBuilder builder) {
			return builder.entry(entry).stopLoss(stopLoss).takeProfit(takeProfit).riskReward(riskReward);
		}
	}
}

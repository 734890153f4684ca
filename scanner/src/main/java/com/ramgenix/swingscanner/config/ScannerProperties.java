package com.ramgenix.swingscanner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Tunable thresholds for the scan pipeline, bound from {@code scanner.*}.
 * Field defaults are the production constants, so a plain {@code new ScannerProperties()} is a fully usable
 * configuration.
 */
@Getter
@Setter
@ToString
@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {

	private String benchmarkSymbol = "SPY";
	private String dataDirectory = "data";
	private String universeFile = "data/universe.txt";
	private int concurrencyLimit = 15;
	private int workerThreads = 15;
	private int maxTickers = 2000;

	private int minBars = 60;
	private int minRegimeBars = 22;
	private int minRsDays = 252;
	private int threeMonthBars = 63;

	private Regime regime = new Regime();
	private Zones zones = new Zones();
	private RelativeStrength relativeStrength = new RelativeStrength();
	private Breakout breakout = new Breakout();
	private Trendline trendline = new Trendline();
	private Pullback pullback = new Pullback();
	private Base base = new Base();
	private Risk risk = new Risk();

	@Getter
	@Setter
	@ToString
	public static class Regime {
		private int emaLength = 20;
	}

	@Getter
	@Setter
	@ToString
	public static class Zones {
		private int atrLength = 14;
		private int minWeeks = 10;
		private int minPoints = 10;
		private int gridPoints = 600;
		private double gridLowFactor = 0.98;
		private double gridHighFactor = 1.02;
		private int peakSeparation = 8;
		private double peakPercentileCut = 30.0;
		private double bandAtrFraction = 0.2;
	}

	@Getter
	@Setter
	@ToString
	public static class RelativeStrength {
		private int window = 252;
		private double blueDotTolerance = 0.995;
	}

	@Getter
	@Setter
	@ToString
	public static class Breakout {
		private int fastEma = 8;
		private int slowEma = 20;
		private int trendSma = 50;
		private int volumeSma = 50;
		private double confirmedVolumeRatio = 1.5;
		private double confirmedMinExtension = 0.005;
		private double confirmedMaxExtension = 0.03;
		private double trendlineVolumeRatio = 1.2;
		private double trendlineStopFactor = 0.98;
		private double levelMinExtension = 0.001;
		private double levelMaxExtension = 0.025;
		private double levelVolumeRatio = 1.15;
		private double rsLeadMaxDistance = 0.03;
		private int dryRecentRangeBars = 5;
		private int dryPriorRangeBars = 20;
		private int dryCurveBars = 15;
		private double dryCurveEpsilon = 0.005;
		private int dryVolumeBars = 3;
		private double dryVolumeRatio = 1.5;
		private double dryMaxDistanceBelowLevel = 0.05;
		private double watchlistProximity = 0.015;
	}

	@Getter
	@Setter
	@ToString
	public static class Trendline {
		private int lookback = 120;
		private double prominenceFactor = 0.3;
		private int peakDistance = 5;
		private double touchTolerance = 0.008;
		private int minTouches = 2;
	}

	@Getter
	@Setter
	@ToString
	public static class Pullback {
		private int cciLength = 20;
		private double cciOversold = -100.0;
		private double supportTolerance = 0.005;
		private double emaProximity = 0.008;
		private int quietVolumeBars = 3;
	}

	@Getter
	@Setter
	@ToString
	public static class Base {
		private int longSma = 200;
		private int smaRiseBars = 20;
		private int yearBars = 252;
		private double minAdvance = 0.30;
		private int cupLookback = 120;
		private double cupMinDepth = 0.12;
		private double cupMaxDepth = 0.35;
		private double rimRecovery = 0.10;
		private int cupMinBars = 20;
		private int handleSearchBars = 26;
		private int handleMinBars = 4;
		private double handleMinPullback = 0.03;
		private double handleMaxPullback = 0.15;
		private double breakoutVolumeRatio = 1.2;
		private double pivotProximity = 0.010;
		private double cupMaxRecentVolume = 0.85;
		private int flatMaxBars = 60;
		private int flatMinBars = 25;
		private double flatMaxDepth = 0.12;
		private double flatUpperRange = 0.75;
		private double flatMaxRecentVolume = 0.75;
		private double minQualityScore = 25;
	}

	@Getter
	@Setter
	@ToString
	public static class Risk {
		private int atrLength = 14;
		private double entryFactor = 1.001;
		private double stopAtrFraction = 0.2;
		private double maxRiskFraction = 0.15;
		private double rewardMultiple = 2.0;
	}
}

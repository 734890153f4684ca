package com.ramgenix.swingscanner.entity;

/**
 * Metadata keys shared between the engines and the persistence layer.
 */
public final class SetupMetadata {

	public static final String PATH = "path";
	public static final String RESISTANCE_LEVEL = "resistanceLevel";
	public static final String VOLUME_RATIO = "volumeRatio";
	public static final String IS_BREAKOUT = "isBreakout";
	public static final String IS_RS_LEAD = "isRsLead";
	public static final String TR_CONTRACTION_PCT = "trContractionPct";
	public static final String TRENDLINE_VALUE = "trendlineValue";
	public static final String TRENDLINE_SLOPE = "trendlineSlope";
	public static final String TRENDLINE_TOUCHES = "trendlineTouches";
	public static final String RS_VS_BENCHMARK = "rsVsBenchmark";

	public static final String CCI_TODAY = "cciToday";
	public static final String CCI_YESTERDAY = "cciYesterday";
	public static final String SUPPORT_LEVEL = "supportLevel";
	public static final String EMA8 = "ema8";
	public static final String EMA20 = "ema20";
	public static final String IS_RELAXED = "isRelaxed";

	public static final String BASE_TYPE = "baseType";
	public static final String SIGNAL = "signal";
	public static final String QUALITY_SCORE = "qualityScore";
	public static final String BASE_DEPTH_PCT = "baseDepthPct";
	public static final String BASE_LENGTH_DAYS = "baseLengthDays";
	public static final String VOLUME_DRY_PCT = "volumeDryPct";
	public static final String RS_VS_BENCHMARK_PCT = "rsVsBenchmarkPct";
	public static final String GEOMETRY = "geometry";

	public static final String LEVEL_TYPE = "levelType";
	public static final String LEVEL = "level";
	public static final String DISTANCE_PCT = "distancePct";
	public static final String RS_BLUE_DOT = "rsBlueDot";

	public static final String RS_RATIO = "rsRatio";
	public static final String RS_RATIO_HIGH = "rsRatioHigh";
	public static final String RS_TREND = "rsTrend";

	private SetupMetadata() {
	}
}

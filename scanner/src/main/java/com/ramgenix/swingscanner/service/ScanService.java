package com.ramgenix.swingscanner.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerConfig;
import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.BarSeries;
import com.ramgenix.swingscanner.entity.PriceBar;
import com.ramgenix.swingscanner.entity.RegimeSnapshot;
import com.ramgenix.swingscanner.entity.RsLine;
import com.ramgenix.swingscanner.entity.Setup;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.SetupType;
import com.ramgenix.swingscanner.entity.TickerEntry;
import com.ramgenix.swingscanner.entity.Trendline;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;

/**
 * Runs one scan over the ticker universe: regime gate on the benchmark, then zones, relative strength and the three
 * pattern engines per ticker. Every scan owns its {@link ScanProgress}; this service only remembers the latest one.
 */
@Service
public class ScanService {

	private static final Logger LOG = LoggerFactory.getLogger(ScanService.class);
	private static final DateTimeFormatter SCAN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");
	private static final Comparator<Setup> SETUP_ORDER = Comparator.comparing(Setup::getTicker)
			.thenComparing(Setup::getSetupType);

	private final ScannerProperties properties;
	private final MarketDataProvider marketDataProvider;
	private final TickerUniverseProvider tickerUniverseProvider;
	private final MarketRegimeService marketRegimeService;
	private final SupportResistanceService supportResistanceService;
	private final RelativeStrengthService relativeStrengthService;
	private final TrendlineService trendlineService;
	private final BreakoutScannerService breakoutScannerService;
	private final PullbackScannerService pullbackScannerService;
	private final BasePatternScannerService basePatternScannerService;
	private final ScanResultStore scanResultStore;
	private final ExecutorService launcherExecutor;
	private final ExecutorService tickerExecutor;
	private final ExecutorService analysisExecutor;

	private final AtomicReference<ScanProgress> currentProgress = new AtomicReference<>();
	private volatile ScanResult lastResult;

	public ScanService(ScannerProperties properties, MarketDataProvider marketDataProvider,
			TickerUniverseProvider tickerUniverseProvider, MarketRegimeService marketRegimeService,
			SupportResistanceService supportResistanceService, RelativeStrengthService relativeStrengthService,
			TrendlineService trendlineService, BreakoutScannerService breakoutScannerService,
			PullbackScannerService pullbackScannerService, BasePatternScannerService basePatternScannerService,
			ScanResultStore scanResultStore,
			@Qualifier(ScannerConfig.LAUNCHER_EXECUTOR) ExecutorService launcherExecutor,
			@Qualifier(ScannerConfig.TICKER_EXECUTOR) ExecutorService tickerExecutor,
			@Qualifier(ScannerConfig.ANALYSIS_EXECUTOR) ExecutorService analysisExecutor) {
		this.properties = properties;
		this.marketDataProvider = marketDataProvider;
		this.tickerUniverseProvider = tickerUniverseProvider;
		this.marketRegimeService = marketRegimeService;
		this.supportResistanceService = supportResistanceService;
		this.relativeStrengthService = relativeStrengthService;
		this.trendlineService = trendlineService;
		this.breakoutScannerService = breakoutScannerService;
		this.pullbackScannerService = pullbackScannerService;
		this.basePatternScannerService = basePatternScannerService;
		this.scanResultStore = scanResultStore;
		this.launcherExecutor = launcherExecutor;
		this.tickerExecutor = tickerExecutor;
		this.analysisExecutor = analysisExecutor;
	}

	/**
	 * Starts a scan in the background and returns its progress right away.
	 *
	 * @throws ScanInProgressException if the previous scan has not finished
	 */
	public ScanProgress startScan() {
		ScanProgress progress = claimProgress();
		launcherExecutor.execute(() -> {
			try {
				runScan(progress);
			} catch (RuntimeException e) {
				LOG.error("Scan {} aborted", progress.getScanId(), e);
				progress.abort(e.getMessage());
			}
		});
		return progress;
	}

	/**
	 * Runs a scan on the calling thread.
	 *
	 * @throws ScanInProgressException if another scan is running
	 */
	public ScanResult runScan() {
		ScanProgress progress = claimProgress();
		try {
			return runScan(progress);
		} catch (RuntimeException e) {
			progress.abort(e.getMessage());
			throw e;
		}
	}

	private ScanProgress claimProgress() {
		ScanProgress progress = new ScanProgress(LocalDateTime.now().format(SCAN_ID_FORMAT));
		progress.start(0);
		ScanProgress previous = currentProgress.get();
		if (previous != null && previous.isInProgress()) {
			throw new ScanInProgressException(previous);
		}
		if (!currentProgress.compareAndSet(previous, progress)) {
			throw new ScanInProgressException(currentProgress.get());
		}
		return progress;
	}

	ScanResult runScan(ScanProgress progress) {
		String scanId = progress.getScanId();
		List<TickerEntry> universe = tickerUniverseProvider.loadUniverse();
		progress.start(universe.size());
		LocalDateTime startedAt = progress.getStartedAt();
		String benchmarkSymbol = properties.getBenchmarkSymbol();
		LOG.info("Scan {} started: {} tickers, benchmark {}", scanId, universe.size(), benchmarkSymbol);

		List<PriceBar> benchmarkBars = fetchBenchmark(benchmarkSymbol);
		RegimeSnapshot regime = marketRegimeService.evaluate(benchmarkBars);
		BarSeries benchmark = new BarSeries(benchmarkSymbol, benchmarkBars);
		double benchmarkReturn = StockCalculationUtility.periodReturn(benchmark.closes(),
				properties.getThreeMonthBars());
		if (Double.isNaN(benchmarkReturn)) {
			benchmarkReturn = 0.0;
		}
		LOG.info("Scan {}: regime {} ({} close {} vs EMA {}), 3m return {}", scanId, regime.getLabel(),
				benchmarkSymbol, regime.getClose(), regime.getEma20(), String.format("%.4f", benchmarkReturn));

		ScanResult.ScanResultBuilder builder = ScanResult.builder().scanId(scanId).regime(regime)
				.benchmarkReturn3m(benchmarkReturn).tickerCount(universe.size()).startedAt(startedAt);

		if (!regime.isBullish()) {
			LOG.warn("Scan {}: regime is {}, pattern engines skipped for all {} tickers", scanId, regime.getLabel(),
					universe.size());
			return finish(builder.build(), progress);
		}

		ScanContext context = new ScanContext(scanId, benchmark, regime, benchmarkReturn,
				properties.getConcurrencyLimit(), progress);
		List<CompletableFuture<TickerOutcome>> futures = universe.stream()
				.map(entry -> CompletableFuture.supplyAsync(() -> analyzeTicker(entry, context), tickerExecutor))
				.collect(Collectors.toList());
		CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

		List<Setup> setups = new ArrayList<>();
		for (CompletableFuture<TickerOutcome> future : futures) {
			TickerOutcome outcome = future.join();
			if (outcome.failed) {
				builder.failedTicker(outcome.ticker);
				continue;
			}
			if (!outcome.zones.isEmpty()) {
				builder.zones(outcome.ticker, outcome.zones);
			}
			setups.addAll(outcome.setups);
		}
		setups.sort(SETUP_ORDER);
		builder.setups(setups);
		return finish(builder.build(), progress);
	}

	private ScanResult finish(ScanResult partial, ScanProgress progress) {
		ScanResult result = partial.toBuilder().completedAt(LocalDateTime.now()).build();
		try {
			scanResultStore.save(result);
		} catch (RuntimeException e) {
			LOG.error("Scan {} could not be saved", result.getScanId(), e);
			lastResult = result;
			progress.abort("save failed: " + e.getMessage());
			return result;
		}
		logSummary(result);
		lastResult = result;
		progress.complete();
		return result;
	}

	private List<PriceBar> fetchBenchmark(String symbol) {
		try {
			return marketDataProvider.fetchDailyBars(symbol);
		} catch (MarketDataException e) {
			LOG.warn("Benchmark {} unavailable: {}", symbol, e.getMessage());
			return Collections.emptyList();
		}
	}

	/**
	 * Whole pipeline for one ticker. Never throws: failures are logged and reported as a failed outcome.
	 */
	TickerOutcome analyzeTicker(TickerEntry entry, ScanContext context) {
		String ticker = entry.getSymbol();
		try {
			List<PriceBar> bars = fetchLimited(ticker, context);
			if (bars.size() < properties.getMinBars()) {
				LOG.debug("{}: skipped, only {} bars", ticker, bars.size());
				return TickerOutcome.empty(ticker);
			}
			BarSeries series = new BarSeries(ticker, bars);

			CompletableFuture<List<Zone>> zonesTask = CompletableFuture
					.supplyAsync(() -> supportResistanceService.extractZones(series), analysisExecutor);
			Optional<RsLine> rsLine = relativeStrengthService.calculate(series, context.getBenchmark());
			List<Zone> zones = zonesTask.join();

			boolean blueDot = rsLine.map(RsLine::isBlueDot).orElse(false);
			rsLine.ifPresent(rs -> LOG.debug("{}: {}", ticker, rs));

			List<Setup> setups = runEngines(series, zones, context.getBenchmarkReturn3m(), blueDot);
			List<Setup> labelled = new ArrayList<>(setups.size());
			for (Setup setup : setups) {
				Setup withSector = label(setup, entry, rsLine.orElse(null));
				LOG.info("{} [{}] {} entry={} stop={} target={} {}", ticker, entry.getSector(),
						withSector.getSetupType(), withSector.getEntry(), withSector.getStopLoss(),
						withSector.getTakeProfit(), withSector.getMetadata());
				labelled.add(withSector);
			}
			return new TickerOutcome(ticker, zones, labelled, false);
		} catch (MarketDataException e) {
			LOG.warn("{}: market data unavailable, skipped: {}", ticker, e.getMessage());
			context.getProgress().tickerFailed(ticker, e.getMessage());
			return TickerOutcome.failed(ticker);
		} catch (RuntimeException e) {
			LOG.error("{}: analysis failed", ticker, e);
			context.getProgress().tickerFailed(ticker, String.valueOf(e.getMessage()));
			return TickerOutcome.failed(ticker);
		} finally {
			context.getProgress().tickerDone();
		}
	}

	/**
	 * Adds the ticker's sector and, when the RS line could be computed, today's ratio, its yearly high and the
	 * one-day trend.
	 */
	static Setup label(Setup setup, TickerEntry entry, RsLine rsLine) {
		Setup.SetupBuilder builder = setup.toBuilder().sector(entry.getSector());
		if (rsLine != null && rsLine.size() > 0) {
			builder.meta(SetupMetadata.RS_RATIO, rsLine.getToday())
					.meta(SetupMetadata.RS_RATIO_HIGH, rsLine.getHigh())
					.meta(SetupMetadata.RS_TREND, rsLine.getTrend().name());
		}
		return builder.build();
	}

	private List<PriceBar> fetchLimited(String ticker, ScanContext context) {
		try {
			context.getLimiter().acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new MarketDataException("Interrupted waiting to fetch " + ticker, e);
		}
		try {
			return marketDataProvider.fetchDailyBars(ticker);
		} finally {
			context.getLimiter().release();
		}
	}

	/**
	 * Breakout (watchlist when no breakout), then pullback, then base. Each engine contributes at most one setup.
	 */
	List<Setup> runEngines(BarSeries series, List<Zone> zones, double benchmarkReturn, boolean blueDot) {
		List<Setup> setups = new ArrayList<>();
		Trendline trendline = trendlineService.detect(series).orElse(null);

		DetectionResult breakout = breakoutScannerService.scan(series, zones, benchmarkReturn, blueDot, trendline);
		if (breakout.isDetected()) {
			breakout.getSetup().ifPresent(setups::add);
		} else {
			breakoutScannerService.scanNearBreakout(series, zones, trendline, blueDot).getSetup()
					.ifPresent(setups::add);
		}
		pullbackScannerService.scan(series, zones).getSetup().ifPresent(setups::add);
		basePatternScannerService.scan(series, benchmarkReturn, blueDot).getSetup().ifPresent(setups::add);
		return setups;
	}

	private void logSummary(ScanResult result) {
		Map<SetupType, Integer> byType = new EnumMap<>(SetupType.class);
		Map<String, Integer> bySector = new TreeMap<>();
		for (Setup setup : result.getSetups()) {
			byType.merge(setup.getSetupType(), 1, Integer::sum);
			bySector.merge(setup.getSector() == null ? TickerEntry.UNKNOWN_SECTOR : setup.getSector(), 1,
					Integer::sum);
		}
		LOG.info("Scan {} completed: {} tickers, {} failed, {} setups {}", result.getScanId(),
				result.getTickerCount(), result.getFailedTickers().size(), result.getSetups().size(), byType);
		if (!bySector.isEmpty()) {
			LOG.info("Scan {} setups by sector: {}", result.getScanId(), bySector);
		}
	}

	public Optional<ScanProgress> getCurrentProgress() {
		return Optional.ofNullable(currentProgress.get());
	}

	public Optional<ScanResult> getLastResult() {
		return Optional.ofNullable(lastResult);
	}

	static final class TickerOutcome {

		private final String ticker;
		private final List<Zone> zones;
		private final List<Setup> setups;
		private final boolean failed;

		TickerOutcome(String ticker, List<Zone> zones, List<Setup> setups, boolean failed) {
			this.ticker = ticker;
			this.zones = zones == null ? Collections.emptyList() : zones;
			this.setups = setups;
			this.failed = failed;
		}

		static TickerOutcome empty(String ticker) {
			return new TickerOutcome(ticker, Collections.emptyList(), Collections.emptyList(), false);
		}

		static TickerOutcome failed(String ticker) {
			return new TickerOutcome(ticker, Collections.emptyList(), Collections.emptyList(), true);
		}

		List<Setup> getSetups() {
			return setups;
		}

		boolean isFailed() {
			return failed;
		}
	}
}

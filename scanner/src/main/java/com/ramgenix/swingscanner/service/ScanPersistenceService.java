package com.ramgenix.swingscanner.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ramgenix.swingscanner.entity.ScanRun;
import com.ramgenix.swingscanner.entity.Setup;
import com.ramgenix.swingscanner.entity.SetupMetadata;
import com.ramgenix.swingscanner.entity.SetupRecord;
import com.ramgenix.swingscanner.entity.SetupType;
import com.ramgenix.swingscanner.entity.TickerEntry;
import com.ramgenix.swingscanner.entity.Zone;
import com.ramgenix.swingscanner.entity.ZoneRecord;
import com.ramgenix.swingscanner.repository.ScanRunRepository;
import com.ramgenix.swingscanner.repository.SetupRecordRepository;
import com.ramgenix.swingscanner.repository.ZoneRecordRepository;

/**
 * JPA-backed store for scan runs, zones and setups, plus the read queries used by the web layer.
 */
@Service
public class ScanPersistenceService implements ScanResultStore {

	private static final Logger LOG = LoggerFactory.getLogger(ScanPersistenceService.class);

	private final ScanRunRepository scanRunRepository;
	private final SetupRecordRepository setupRecordRepository;
	private final ZoneRecordRepository zoneRecordRepository;
	private final ObjectMapper objectMapper;

	public ScanPersistenceService(ScanRunRepository scanRunRepository, SetupRecordRepository setupRecordRepository,
			ZoneRecordRepository zoneRecordRepository, ObjectMapper objectMapper) {
		this.scanRunRepository = scanRunRepository;
		this.setupRecordRepository = setupRecordRepository;
		this.zoneRecordRepository = zoneRecordRepository;
		this.objectMapper = objectMapper;
	}

	@Override
	@Transactional
	public void save(ScanResult result) {
		String scanId = result.getScanId();
		ScanRun run = ScanRun.builder().scanId(scanId).startedAt(result.getStartedAt())
				.completedAt(result.getCompletedAt()).regimeLabel(result.getRegime().getLabel())
				.bullish(result.getRegime().isBullish()).benchmarkClose(finiteOrNull(result.getRegime().getClose()))
				.benchmarkEma20(finiteOrNull(result.getRegime().getEma20()))
				.benchmarkReturn3m(finiteOrNull(result.getBenchmarkReturn3m())).tickerCount(result.getTickerCount())
				.setupCount(result.getSetups().size()).failedCount(result.getFailedTickers().size())
				.status(result.getRegime().isBullish() ? ScanRun.STATUS_COMPLETED : ScanRun.STATUS_SKIPPED).build();
		scanRunRepository.save(run);

		List<ZoneRecord> zoneRecords = new ArrayList<>();
		for (Map.Entry<String, List<Zone>> entry : result.getZonesByTicker().entrySet()) {
			for (Zone zone : entry.getValue()) {
				zoneRecords.add(ZoneRecord.builder().scanId(scanId).ticker(entry.getKey()).level(zone.getLevel())
						.upper(zone.getUpper()).lower(zone.getLower()).type(zone.getType()).atr(zone.getAtr())
						.build());
			}
		}
		if (!zoneRecords.isEmpty()) {
			zoneRecordRepository.saveAll(zoneRecords);
		}

		List<SetupRecord> setupRecords = new ArrayList<>();
		for (Setup setup : result.getSetups()) {
			setupRecords.add(toRecord(scanId, setup));
		}
		if (!setupRecords.isEmpty()) {
			setupRecordRepository.saveAll(setupRecords);
		}
		LOG.info("Scan {} saved: {} zones, {} setups", scanId, zoneRecords.size(), setupRecords.size());
	}

	SetupRecord toRecord(String scanId, Setup setup) {
		Object path = setup.meta(SetupMetadata.PATH);
		Object baseType = setup.meta(SetupMetadata.BASE_TYPE);
		Object levelType = setup.meta(SetupMetadata.LEVEL_TYPE);
		String subType = path != null ? path.toString()
				: baseType != null ? baseType.toString() : levelType != null ? levelType.toString() : null;
		if (setup.getSetupType() == SetupType.PULLBACK) {
			subType = Boolean.TRUE.equals(setup.meta(SetupMetadata.IS_RELAXED)) ? "RELAXED" : "STRICT";
		}
		Object score = setup.meta(SetupMetadata.QUALITY_SCORE);
		Object signal = setup.meta(SetupMetadata.SIGNAL);
		Object distance = setup.meta(SetupMetadata.DISTANCE_PCT);

		return SetupRecord.builder().scanId(scanId).ticker(setup.getTicker()).sector(setup.getSector())
				.setupType(setup.getSetupType()).subType(subType).entry(setup.getEntry())
				.stopLoss(setup.getStopLoss()).takeProfit(setup.getTakeProfit()).riskReward(setup.getRiskReward())
				.setupDate(setup.getSetupDate()).qualityScore(score instanceof Number ? ((Number) score).intValue() : null)
				.signal(signal != null ? signal.toString() : null)
				.distancePct(distance instanceof Number ? ((Number) distance).doubleValue() : null)
				.metadata(renderMetadata(setup.getMetadata())).build();
	}

	private String renderMetadata(Map<String, Object> metadata) {
		try {
			return objectMapper.writeValueAsString(metadata);
		} catch (JsonProcessingException e) {
			LOG.warn("Metadata not serializable, storing text form: {}", e.getMessage());
			return String.valueOf(metadata);
		}
	}

	public Optional<ScanRun> findRun(String scanId) {
		return scanRunRepository.findByScanId(scanId);
	}

	public Optional<ScanRun> findLatestCompletedRun() {
		return scanRunRepository.findFirstByCompletedAtIsNotNullOrderByCompletedAtDesc();
	}

	public List<SetupRecord> findLatestSetups(SetupType type) {
		Optional<ScanRun> latest = findLatestCompletedRun();
		if (latest.isEmpty()) {
			return Collections.emptyList();
		}
		String scanId = latest.get().getScanId();
		if (type == null) {
			return setupRecordRepository.findByScanIdOrderByTickerAsc(scanId);
		}
		if (type == SetupType.WATCHLIST) {
			return setupRecordRepository.findWatchlistByScanId(scanId);
		}
		return setupRecordRepository.findByScanIdAndSetupTypeOrderByTickerAsc(scanId, type);
	}

	public List<ZoneRecord> findLatestZones(String ticker) {
		return findLatestCompletedRun()
				.map(run -> zoneRecordRepository.findByScanIdAndTickerOrderByLevelAsc(run.getScanId(), ticker))
				.orElse(Collections.emptyList());
	}

	/** Setup counts per sector for the latest completed scan, largest first. */
	public Map<String, Long> findLatestSectorCounts() {
		Map<String, Long> counts = new LinkedHashMap<>();
		findLatestCompletedRun().ifPresent(run -> {
			for (Object[] row : setupRecordRepository.countBySector(run.getScanId())) {
				counts.put(row[0] == null ? TickerEntry.UNKNOWN_SECTOR : row[0].toString(), ((Number) row[1]).longValue());
			}
		});
		return counts;
	}

	private static Double finiteOrNull(double value) {
		return Double.isFinite(value) ? value : null;
	}
}

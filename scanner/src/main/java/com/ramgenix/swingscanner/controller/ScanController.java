package com.ramgenix.swingscanner.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ramgenix.swingscanner.dto.RegimeResponse;
import com.ramgenix.swingscanner.dto.ScanStatusResponse;
import com.ramgenix.swingscanner.entity.ScanRun;
import com.ramgenix.swingscanner.entity.SetupRecord;
import com.ramgenix.swingscanner.entity.SetupType;
import com.ramgenix.swingscanner.entity.ZoneRecord;
import com.ramgenix.swingscanner.service.ScanInProgressException;
import com.ramgenix.swingscanner.service.ScanPersistenceService;
import com.ramgenix.swingscanner.service.ScanProgress;
import com.ramgenix.swingscanner.service.ScanService;

@RestController
@RequestMapping("/api")
public class ScanController {

	private static final Logger LOG = LoggerFactory.getLogger(ScanController.class);

	@Autowired
	private ScanService scanService;

	@Autowired
	private ScanPersistenceService scanPersistenceService;

	@PostMapping("/scan")
	public ResponseEntity<ScanStatusResponse> startScan() {
		try {
			ScanProgress progress = scanService.startScan();
			LOG.info("Scan {} requested", progress.getScanId());
			return ResponseEntity.status(HttpStatus.ACCEPTED).body(ScanStatusResponse.from(progress));
		} catch (ScanInProgressException e) {
			LOG.info(e.getMessage());
			return ResponseEntity.status(HttpStatus.CONFLICT).body(ScanStatusResponse.from(e.getRunning()));
		}
	}

	@GetMapping("/scan/status")
	public ResponseEntity<ScanStatusResponse> getStatus() {
		return scanService.getCurrentProgress().map(ScanStatusResponse::from).map(ResponseEntity::ok)
				.orElseGet(() -> ResponseEntity.notFound().build());
	}

	@GetMapping("/scan/{scanId}")
	public ResponseEntity<ScanRun> getScan(@PathVariable String scanId) {
		return scanPersistenceService.findRun(scanId).map(ResponseEntity::ok)
				.orElseGet(() -> ResponseEntity.notFound().build());
	}

	@GetMapping("/regime")
	public ResponseEntity<RegimeResponse> getRegime() {
		Optional<RegimeResponse> regime = scanService.getLastResult().map(RegimeResponse::from);
		if (regime.isEmpty()) {
			regime = scanPersistenceService.findLatestCompletedRun().map(RegimeResponse::from);
		}
		return regime.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
	}

	@GetMapping("/setups")
	public ResponseEntity<List<SetupRecord>> getSetups(@RequestParam(required = false) String type) {
		SetupType setupType = null;
		if (type != null && !type.isBlank()) {
			try {
				setupType = SetupType.valueOf(type.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException e) {
				return ResponseEntity.badRequest().build();
			}
		}
		if (scanPersistenceService.findLatestCompletedRun().isEmpty()) {
			return ResponseEntity.notFound().build();
		}
		return ResponseEntity.ok(scanPersistenceService.findLatestSetups(setupType));
	}

	@GetMapping("/setups/sectors")
	public ResponseEntity<Map<String, Long>> getSectorCounts() {
		if (scanPersistenceService.findLatestCompletedRun().isEmpty()) {
			return ResponseEntity.notFound().build();
		}
		return ResponseEntity.ok(scanPersistenceService.findLatestSectorCounts());
	}

	@GetMapping("/zones/{ticker}")
	public ResponseEntity<List<ZoneRecord>> getZones(@PathVariable String ticker) {
		if (scanPersistenceService.findLatestCompletedRun().isEmpty()) {
			return ResponseEntity.notFound().build();
		}
		return ResponseEntity.ok(scanPersistenceService.findLatestZones(ticker.toUpperCase(Locale.ROOT)));
	}

	@GetMapping("/health")
	public ResponseEntity<Map<String, Object>> health() {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("status", "UP");
		body.put("scanInProgress", scanService.getCurrentProgress().map(ScanProgress::isInProgress).orElse(false));
		return ResponseEntity.ok(body);
	}
}

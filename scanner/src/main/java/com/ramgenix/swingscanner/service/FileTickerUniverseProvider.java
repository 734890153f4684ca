package com.ramgenix.swingscanner.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.TickerEntry;

import io.micrometer.common.util.StringUtils;

/**
 * Universe file with one {@code SYMBOL[,Sector]} per line. Blank lines and {@code #} comments are skipped, symbols
 * are upper-cased and the first occurrence of a symbol wins.
 */
@Service
public class FileTickerUniverseProvider implements TickerUniverseProvider {

	private static final Logger LOG = LoggerFactory.getLogger(FileTickerUniverseProvider.class);

	private final Path universeFile;
	private final int maxTickers;

	@Autowired
	public FileTickerUniverseProvider(ScannerProperties properties) {
		this(Paths.get(properties.getUniverseFile()), properties.getMaxTickers());
	}

	public FileTickerUniverseProvider(Path universeFile, int maxTickers) {
		this.universeFile = universeFile;
		this.maxTickers = maxTickers;
	}

	@Override
	public List<TickerEntry> loadUniverse() {
		Map<String, TickerEntry> entries = new LinkedHashMap<>();
		try (BufferedReader reader = Files.newBufferedReader(universeFile, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null) {
				TickerEntry entry = parseLine(line);
				if (entry != null) {
					entries.putIfAbsent(entry.getSymbol(), entry);
				}
			}
		} catch (IOException e) {
			LOG.error("Error reading universe file {}: {}", universeFile, e.getMessage());
			throw new MarketDataException("Cannot read ticker universe " + universeFile, e);
		}

		List<TickerEntry> universe = new ArrayList<>(entries.values());
		if (universe.size() > maxTickers) {
			LOG.info("Universe capped from {} to {} tickers", universe.size(), maxTickers);
			universe = new ArrayList<>(universe.subList(0, maxTickers));
		}
		return universe;
	}

	static TickerEntry parseLine(String line) {
		if (line == null) {
			return null;
		}
		String trimmed = line.trim();
		if (trimmed.isEmpty() || trimmed.startsWith("#")) {
			return null;
		}
		String[] parts = trimmed.split(",", 2);
		String symbol = parts[0].trim().toUpperCase(Locale.ROOT);
		if (StringUtils.isBlank(symbol)) {
			return null;
		}
		String sector = parts.length > 1 && StringUtils.isNotBlank(parts[1]) ? parts[1].trim()
				: TickerEntry.UNKNOWN_SECTOR;
		return new TickerEntry(symbol, sector);
	}
}

package com.ramgenix.swingscanner.service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.opencsv.bean.CsvToBean;
import com.opencsv.bean.CsvToBeanBuilder;
import com.ramgenix.swingscanner.config.ScannerProperties;
import com.ramgenix.swingscanner.entity.DailyBarRow;
import com.ramgenix.swingscanner.entity.PriceBar;
import com.ramgenix.swingscanner.utility.StockCalculationUtility;

import io.micrometer.common.util.StringUtils;

/**
 * Reads {@code <dataDirectory>/<SYMBOL>.csv} files with the columns {@code Date,Open,High,Low,Close,Adj Close,Volume}.
 * Rows with unparseable or inconsistent numbers are dropped; later rows win on duplicate dates.
 */
@Service
public class CsvMarketDataProvider implements MarketDataProvider {

	private static final Logger LOG = LoggerFactory.getLogger(CsvMarketDataProvider.class);

	private final Path dataDirectory;

	@Autowired
	public CsvMarketDataProvider(ScannerProperties properties) {
		this(Paths.get(properties.getDataDirectory()));
	}

	public CsvMarketDataProvider(Path dataDirectory) {
		this.dataDirectory = dataDirectory;
	}

	@Override
	public List<PriceBar> fetchDailyBars(String symbol) {
		if (StringUtils.isBlank(symbol)) {
			return Collections.emptyList();
		}
		Path file = dataDirectory.resolve(symbol.trim().toUpperCase(Locale.ROOT) + ".csv");
		if (!Files.isRegularFile(file)) {
			LOG.debug("No data file for {} at {}", symbol, file);
			return Collections.emptyList();
		}

		List<DailyBarRow> rows;
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			CsvToBean<DailyBarRow> csvToBean = new CsvToBeanBuilder<DailyBarRow>(reader).withType(DailyBarRow.class)
					.withIgnoreLeadingWhiteSpace(true).build();
			rows = csvToBean.parse();
		} catch (IOException | RuntimeException e) {
			throw new MarketDataException("Failed to read " + file + ": " + e.getMessage(), e);
		}

		Map<LocalDate, PriceBar> byDate = new TreeMap<>();
		int dropped = 0;
		for (DailyBarRow row : rows) {
			PriceBar bar = toPriceBar(row);
			if (bar == null) {
				dropped++;
				continue;
			}
			byDate.put(bar.getDate(), bar);
		}
		if (dropped > 0) {
			LOG.debug("{}: dropped {} invalid rows", symbol, dropped);
		}
		return new ArrayList<>(byDate.values());
	}

	static PriceBar toPriceBar(DailyBarRow row) {
		if (row == null || StringUtils.isBlank(row.getDate())) {
			return null;
		}
		LocalDate date;
		try {
			date = LocalDate.parse(row.getDate().trim());
		} catch (DateTimeParseException e) {
			return null;
		}
		double open = StockCalculationUtility.parseDouble(row.getOpen());
		double high = StockCalculationUtility.parseDouble(row.getHigh());
		double low = StockCalculationUtility.parseDouble(row.getLow());
		double close = StockCalculationUtility.parseDouble(row.getClose());
		double adjClose = StringUtils.isBlank(row.getAdjClose()) ? close
				: StockCalculationUtility.parseDouble(row.getAdjClose());
		double volume = StockCalculationUtility.parseDouble(row.getVolume());
		if (!StockCalculationUtility.allFinite(open, high, low, close, adjClose, volume)) {
			return null;
		}
		if (high < low || low < 0 || volume < 0) {
			return null;
		}
		return new PriceBar(date, open, high, low, close, adjClose, volume);
	}
}

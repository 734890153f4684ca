package com.ramgenix.swingscanner.entity;

import com.opencsv.bean.CsvBindByName;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Raw row of a daily bar file. Numbers stay as text until validated.
 */
@Getter
@Setter
@ToString
public class DailyBarRow {

	@CsvBindByName(column = "Date")
	private String date;
	@CsvBindByName(column = "Open")
	private String open;
	@CsvBindByName(column = "High")
	private String high;
	@CsvBindByName(column = "Low")
	private String low;
	@CsvBindByName(column = "Close")
	private String close;
	@CsvBindByName(column = "Adj Close")
	private String adjClose;
	@CsvBindByName(column = "Volume")
	private String volume;
}

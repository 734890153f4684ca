package com.ramgenix.swingscanner.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@Entity
@Builder
public class ScanRun {

	public static final String STATUS_COMPLETED = "COMPLETED";
	public static final String STATUS_SKIPPED = "SKIPPED";

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(unique = true, nullable = false)
	private String scanId;
	private LocalDateTime startedAt;
	private LocalDateTime completedAt;
	private String regimeLabel;
	private boolean bullish;
	private Double benchmarkClose;
	private Double benchmarkEma20;
	private Double benchmarkReturn3m;
	private int tickerCount;
	private int setupCount;
	private int failedCount;
	private String status;
}

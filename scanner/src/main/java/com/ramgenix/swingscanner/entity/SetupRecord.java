package com.ramgenix.swingscanner.entity;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
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
@Table(indexes = { @Index(columnList = "scanId"), @Index(columnList = "scanId,setupType") })
public class SetupRecord {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	private String scanId;
	private String ticker;
	private String sector;
	@Enumerated(EnumType.STRING)
	private SetupType setupType;
	private String subType;
	private Double entry;
	private Double stopLoss;
	private Double takeProfit;
	private Double riskReward;
	private LocalDate setupDate;
	private Integer qualityScore;
	private String signal;
	private Double distancePct;
	@Column(length = 4000)
	private String metadata;
}

package com.ramgenix.swingscanner.dto;

import java.time.LocalDateTime;

import com.ramgenix.swingscanner.service.ScanProgress;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
public class ScanStatusResponse {

	private String scanId;
	private boolean inProgress;
	private int processed;
	private int failed;
	private int total;
	private double percent;
	private LocalDateTime startedAt;
	private LocalDateTime completedAt;
	private String lastError;

	public static ScanStatusResponse from(ScanProgress progress) {
		return new ScanStatusResponse(progress.getScanId(), progress.isInProgress(), progress.getProcessed(),
				progress.getFailed(), progress.getTotal(), Math.round(progress.getPercent() * 10.0) / 10.0,
				progress.getStartedAt(), progress.getCompletedAt(), progress.getLastError());
	}
}

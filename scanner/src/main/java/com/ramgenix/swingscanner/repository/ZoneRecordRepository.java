package com.ramgenix.swingscanner.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ramgenix.swingscanner.entity.ZoneRecord;

public interface ZoneRecordRepository extends JpaRepository<ZoneRecord, Long> {

	List<ZoneRecord> findByScanIdAndTickerOrderByLevelAsc(String scanId, String ticker);

	long countByScanId(String scanId);
}

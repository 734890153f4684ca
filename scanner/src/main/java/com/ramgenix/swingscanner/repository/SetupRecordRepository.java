package com.ramgenix.swingscanner.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.ramgenix.swingscanner.entity.SetupRecord;
import com.ramgenix.swingscanner.entity.SetupType;

public interface SetupRecordRepository extends JpaRepository<SetupRecord, Long> {

	List<SetupRecord> findByScanIdOrderByTickerAsc(String scanId);

	List<SetupRecord> findByScanIdAndSetupTypeOrderByTickerAsc(String scanId, SetupType setupType);

	@Query("SELECT s FROM SetupRecord s WHERE s.scanId = :scanId AND s.setupType = com.ramgenix.swingscanner.entity.SetupType.WATCHLIST ORDER BY s.distancePct ASC")
	List<SetupRecord> findWatchlistByScanId(@Param("scanId") String scanId);

	@Query("SELECT s.sector, COUNT(s) FROM SetupRecord s WHERE s.scanId = :scanId GROUP BY s.sector ORDER BY COUNT(s) DESC")
	List<Object[]> countBySector(@Param("scanId") String scanId);
}

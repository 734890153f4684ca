package com.ramgenix.swingscanner.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ramgenix.swingscanner.entity.ScanRun;

public interface ScanRunRepository extends JpaRepository<ScanRun, Long> {

	Optional<ScanRun> findByScanId(String scanId);

	Optional<ScanRun> findFirstByCompletedAtIsNotNullOrderByCompletedAtDesc();
}

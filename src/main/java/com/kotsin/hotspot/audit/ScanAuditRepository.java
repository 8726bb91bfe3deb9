package com.kotsin.hotspot.audit;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScanAuditRepository extends MongoRepository<ScanAuditRecord, String> {

    List<ScanAuditRecord> findByStoreKeyOrderByScannedAtDesc(String storeKey, Pageable pageable);
}

package com.lendledger.repo;

import com.lendledger.model.LedgerEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface LedgerEventRepo extends MongoRepository<LedgerEventDocument, String> {

    List<LedgerEventDocument> findByTypeAndTsBetweenOrderByTsAsc(String type, Instant from, Instant to);

    List<LedgerEventDocument> findByTsBetweenOrderByTsAsc(Instant from, Instant to);

    List<LedgerEventDocument> findTop100ByUserOrderByTsDesc(String user);

    List<LedgerEventDocument> findTop100ByAssetAndTypeOrderByTsDesc(String asset, String type);

    List<LedgerEventDocument> findByGuaranteeIdOrderByTsAsc(Long guaranteeId);
}

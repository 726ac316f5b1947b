package com.priceintel.backend.repository;

import com.priceintel.backend.model.CreditAccount;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CreditAccountRepository extends MongoRepository<CreditAccount, String> {

    List<CreditAccount> findByPeriodEndLessThanEqual(Instant now);
}

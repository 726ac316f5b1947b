package com.priceintel.backend.repository;

import com.priceintel.backend.model.CreditLedgerEntry;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;

public class CreditLedgerEntryRepositoryImpl implements CreditLedgerEntryRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public CreditLedgerEntryRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public int sumAmountDeltaByOwnerId(String ownerId) {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(Criteria.where("ownerId").is(ownerId)),
                Aggregation.group("ownerId").sum("amountDelta").as("total"));

        AggregationResults<Document> results = mongoTemplate.aggregate(
                aggregation, CreditLedgerEntry.class, Document.class);

        Document row = results.getUniqueMappedResult();
        if (row == null) {
            return 0;
        }
        Number total = row.get("total", Number.class);
        return total != null ? total.intValue() : 0;
    }
}

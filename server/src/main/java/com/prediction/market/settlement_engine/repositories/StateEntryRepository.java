package com.prediction.market.settlement_engine.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.settlement_engine.entity.StateEntry;

@Repository
public interface StateEntryRepository extends MongoRepository<StateEntry, String> {

    /**
     * All entries of one namespace, e.g. every balance. Used for audits.
     */
    List<StateEntry> findByNamespace(String namespace);
}

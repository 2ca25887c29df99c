package com.prediction.market.settlement_engine.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One persisted key of the contract state. {@code value} keeps its type hint so it reads
 * back as the stored entity class.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "contract_state")
public class StateEntry {
    @MongoId
    private String id; // DataKey.storageId()

    @Indexed
    private String namespace;

    private String user; // null for global keys

    private Object value;

    private long updatedAt;
}

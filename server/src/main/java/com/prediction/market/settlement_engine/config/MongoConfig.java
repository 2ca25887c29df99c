package com.prediction.market.settlement_engine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mongo.MongoProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

@Configuration
@EnableTransactionManagement
@ConditionalOnProperty(prefix = "settlement.store", name = "type", havingValue = "mongo")
public class MongoConfig {

    @Bean
    MongoClient mongoClient(MongoProperties mongoProperties) {
        String uri = mongoProperties.getUri() != null ? mongoProperties.getUri() : MongoProperties.DEFAULT_URI;
        return MongoClients.create(uri);
    }

    // Staged commits of MongoStateStore run inside this transaction manager.
    @Bean
    MongoTransactionManager transactionManager(MongoDatabaseFactory mongoDatabaseFactory) {
        return new MongoTransactionManager(mongoDatabaseFactory);
    }
}

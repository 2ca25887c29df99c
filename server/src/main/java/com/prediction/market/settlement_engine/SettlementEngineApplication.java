package com.prediction.market.settlement_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.prediction.market.settlement_engine.config.SettlementProperties;

@SpringBootApplication
@EnableConfigurationProperties(SettlementProperties.class)
public class SettlementEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SettlementEngineApplication.class, args);
    }
}

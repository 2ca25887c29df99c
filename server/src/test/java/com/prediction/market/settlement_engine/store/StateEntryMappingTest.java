package com.prediction.market.settlement_engine.store;

import java.math.BigInteger;
import java.util.List;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.convert.NoOpDbRefResolver;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import com.prediction.market.settlement_engine.entity.BetSide;
import com.prediction.market.settlement_engine.entity.Round;
import com.prediction.market.settlement_engine.entity.RoundMode;
import com.prediction.market.settlement_engine.entity.StateEntry;
import com.prediction.market.settlement_engine.entity.TokenAmount;
import com.prediction.market.settlement_engine.entity.UpDownPositions;
import com.prediction.market.settlement_engine.entity.UserPosition;

import static org.junit.jupiter.api.Assertions.*;

class StateEntryMappingTest {

    private MappingMongoConverter converter;

    @BeforeEach
    void setUp() {
        MongoCustomConversions conversions = new MongoCustomConversions(List.of());
        MongoMappingContext mappingContext = new MongoMappingContext();
        mappingContext.setSimpleTypeHolder(conversions.getSimpleTypeHolder());
        mappingContext.afterPropertiesSet();

        converter = new MappingMongoConverter(NoOpDbRefResolver.INSTANCE, mappingContext);
        converter.setCustomConversions(conversions);
        converter.afterPropertiesSet();
    }

    @Test
    void positions_shouldRoundTrip_forUserIdsWithDots() {
        UpDownPositions positions = UpDownPositions.empty()
                .with("alice.eth", UserPosition.builder().amount(TokenAmount.of(300)).side(BetSide.UP).build())
                .with("bob", UserPosition.builder().amount(TokenAmount.of(200)).side(BetSide.DOWN).build());

        UpDownPositions read = roundTrip(DataKey.upDownPositions(), positions, UpDownPositions.class);

        assertEquals(positions, read);
        assertEquals(TokenAmount.of(300), read.get("alice.eth").orElseThrow().getAmount());
        assertEquals(List.of("alice.eth", "bob"), List.copyOf(read.asMap().keySet()));
    }

    @Test
    void round_shouldRoundTrip() {
        Round round = Round.builder()
                .mode(RoundMode.PRECISION)
                .roundNumber(3)
                .startLedger(100)
                .betEndLedger(106)
                .endLedger(112)
                .priceStart(BigInteger.ONE.shiftLeft(100))
                .poolUp(TokenAmount.of(7))
                .build();

        assertEquals(round, roundTrip(DataKey.activeRound(), round, Round.class));
    }

    private <T> T roundTrip(DataKey key, Object value, Class<T> type) {
        StateEntry entry = StateEntry.builder()
                .id(key.storageId())
                .namespace(key.getNamespace().name())
                .user(key.getUser())
                .value(value)
                .build();

        Document document = new Document();
        converter.write(entry, document);
        StateEntry read = converter.read(StateEntry.class, document);

        assertEquals(key.storageId(), read.getId());
        return type.cast(read.getValue());
    }
}

package com.prediction.market.settlement_engine.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Precision sub-ledger of the active round, in submission order. Copy-on-write.
 */
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PrecisionPredictions {

    private ArrayList<PrecisionPrediction> predictions = new ArrayList<>();

    private PrecisionPredictions(ArrayList<PrecisionPrediction> predictions) {
        this.predictions = predictions;
    }

    public static PrecisionPredictions empty() {
        return new PrecisionPredictions(new ArrayList<>());
    }

    public boolean containsUser(String user) {
        return findByUser(user).isPresent();
    }

    public Optional<PrecisionPrediction> findByUser(String user) {
        return predictions.stream()
                .filter(p -> p.getUser().equals(user))
                .findFirst();
    }

    public PrecisionPredictions with(PrecisionPrediction prediction) {
        ArrayList<PrecisionPrediction> copy = new ArrayList<>(predictions);
        copy.add(prediction);
        return new PrecisionPredictions(copy);
    }

    public List<PrecisionPrediction> asList() {
        return Collections.unmodifiableList(predictions);
    }

    public boolean isEmpty() {
        return predictions.isEmpty();
    }

    public int size() {
        return predictions.size();
    }
}

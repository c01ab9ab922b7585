package dev.devanks.riverflow.daily.batch;

import com.google.cloud.firestore.Firestore;
import dev.devanks.riverflow.daily.config.DailyAggregationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BatchCommitterFactory {

    private final Firestore firestore;
    private final DailyAggregationProperties properties;

    public BatchCommitter open() {
        return new BatchCommitter(firestore, properties.getCommitTimeout());
    }
}

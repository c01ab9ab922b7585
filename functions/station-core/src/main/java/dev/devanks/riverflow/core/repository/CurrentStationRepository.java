package dev.devanks.riverflow.core.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface CurrentStationRepository extends FirestoreReactiveRepository<CurrentStationEntity> {
}

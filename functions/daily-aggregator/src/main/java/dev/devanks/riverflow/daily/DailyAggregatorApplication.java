package dev.devanks.riverflow.daily;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import dev.devanks.riverflow.core.client.HydrometricApiClient;
import dev.devanks.riverflow.core.repository.CurrentStationRepository;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication(scanBasePackages = "dev.devanks.riverflow")
@EnableFeignClients(basePackageClasses = HydrometricApiClient.class)
@EnableReactiveFirestoreRepositories(basePackageClasses = CurrentStationRepository.class)
public class DailyAggregatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(DailyAggregatorApplication.class, args);
    }
}

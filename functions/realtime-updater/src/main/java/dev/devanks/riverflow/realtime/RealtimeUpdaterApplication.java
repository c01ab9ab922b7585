// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/RealtimeUpdaterApplication.java
package dev.devanks.riverflow.realtime;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import dev.devanks.riverflow.core.client.HydrometricApiClient;
import dev.devanks.riverflow.core.model.RunReport;
import dev.devanks.riverflow.core.repository.CurrentStationRepository;
import dev.devanks.riverflow.realtime.service.RealtimeOrchestrator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;

import java.util.function.Supplier;

@SpringBootApplication(scanBasePackages = "dev.devanks.riverflow")
@EnableFeignClients(basePackageClasses = HydrometricApiClient.class)
@EnableReactiveFirestoreRepositories(basePackageClasses = CurrentStationRepository.class)
public class RealtimeUpdaterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeUpdaterApplication.class, args);
    }

    /**
     * Function bean executed by GcfJarLauncher on every scheduled trigger.
     * Station failures are reported in the returned {@link RunReport}; only a broken
     * station catalog escapes as an exception so the invocation is marked failed.
     *
     * @param orchestrator runs the fan-out over the station catalog
     * @return a Supplier bean that performs one realtime update
     */
    @Bean
    public Supplier<RunReport> updateRealtimeData(RealtimeOrchestrator orchestrator) {
        return orchestrator::runUpdate;
    }
}

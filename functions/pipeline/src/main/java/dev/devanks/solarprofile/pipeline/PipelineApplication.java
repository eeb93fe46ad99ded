package dev.devanks.solarprofile.pipeline;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * Site import, CSV download, production upload and yearly profile calculation, each exposed
 * as a function bean by {@link dev.devanks.solarprofile.pipeline.function.PipelineFunctions}.
 */
@SpringBootApplication
@EnableFeignClients
@EnableReactiveFirestoreRepositories
public class PipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineApplication.class, args);
    }
}

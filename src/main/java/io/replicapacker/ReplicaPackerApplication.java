package io.replicapacker;

import io.replicapacker.cli.PlanCommandRunner;
import io.replicapacker.config.PackerConfig;
import io.replicapacker.metrics.MetricsProvider;
import io.replicapacker.planning.PlanManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

import java.util.Arrays;

import static io.replicapacker.config.Constants.OPTION_CSV;

/**
 * Main Spring Boot application class for the replica packer.
 * 
 * Runs as a REST service by default. When started with --csv=... it packs that file
 * once, prints the report, writes the plan file and exits without a web server.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.replicapacker")
public class ReplicaPackerApplication {

    public static void main(String[] args) {
        boolean batchMode = isBatchMode(args);
        log.info("Starting Replica Packer in {} mode", batchMode ? "batch" : "service");
        
        try {
            SpringApplication application = new SpringApplication(ReplicaPackerApplication.class);
            if (batchMode) {
                application.setWebApplicationType(WebApplicationType.NONE);
                System.exit(SpringApplication.exit(application.run(args)));
            }
            application.run(args);
            log.info("Replica Packer REST API started successfully");
            
        } catch (Exception e) {
            log.error("Replica Packer failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
    
    static boolean isBatchMode(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.startsWith("--" + OPTION_CSV + "="));
    }
    
    @Bean
    @Primary
    public PackerConfig config() {
        PackerConfig config = new PackerConfig();
        log.info("Loaded configuration");
        return config;
    }
    
    @Bean
    public PlanManager planManager(PackerConfig config, MetricsProvider metricsProvider) {
        log.info("Initializing PlanManager");
        return new PlanManager(config, metricsProvider);
    }
    
    @Bean
    public PlanCommandRunner planCommandRunner(PlanManager planManager, PackerConfig config) {
        return new PlanCommandRunner(planManager, config);
    }
}

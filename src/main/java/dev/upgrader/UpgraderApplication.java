package dev.upgrader;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class UpgraderApplication implements CommandLineRunner {

    private final CycleRunner cycleRunner;
    private final ExitManager exitManager;

    @Value("${upgrader.run-once:false}")
    private boolean runOnce;

    public UpgraderApplication(CycleRunner cycleRunner, ExitManager exitManager) {
        this.cycleRunner = cycleRunner;
        this.exitManager = exitManager;
    }

    public static void main(String[] args) {
        SpringApplication.run(UpgraderApplication.class, args);
    }

    /**
     * In run-once mode, run both catalogs a single time and exit with the outcome.
     * Otherwise the service keeps running for the HTTP surface and the scheduler.
     */
    @Override
    public void run(String... args) {
        if (!runOnce) {
            log.info("Upgrader service ready");
            return;
        }

        try {
            cycleRunner.execute();
            log.info("Upgrader exiting...");
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Upgrader failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}

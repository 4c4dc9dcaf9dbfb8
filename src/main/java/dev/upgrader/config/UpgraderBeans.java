package dev.upgrader.config;

import dev.upgrader.http.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class UpgraderBeans {

    public static final String RUN_EXECUTOR = "runExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random selectionRandom() {
        return new Random();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD_SLEEP;
    }

    /**
     * Runs upgrade cycles off the request threads. One thread: the run permit already
     * guarantees at most one cycle at a time.
     */
    @Bean(name = RUN_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService runExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "upgrade-run");
            thread.setDaemon(true);
            return thread;
        });
    }
}

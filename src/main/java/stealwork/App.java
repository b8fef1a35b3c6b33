package stealwork;

import stealwork.scheduler.api.SnapshotJson;
import stealwork.scheduler.config.SchedulerConfig;
import stealwork.scheduler.model.SchedulerStats;
import stealwork.scheduler.simulation.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * Runs the work-stealing simulation for a number of seconds (first argument,
 * default 10) with settings from STEALWORK_* environment variables, then
 * prints the final snapshot as JSON.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final long DEFAULT_SECONDS = 10;

    public static void main(String[] args) throws InterruptedException {
        long seconds = DEFAULT_SECONDS;
        if (args.length > 0) {
            try {
                seconds = Long.parseLong(args[0]);
            } catch (NumberFormatException e) {
                System.err.println("Usage: App [seconds]");
                System.exit(2);
            }
        }

        SchedulerConfig config;
        try {
            config = SchedulerConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        SimulationService simulation = new SimulationService(config);
        Runtime.getRuntime().addShutdownHook(new Thread(simulation::stop, "stealwork-shutdown"));

        log.info("Running simulation for {}s", seconds);
        simulation.start();
        Thread.sleep(seconds * 1000);

        SchedulerStats stats = simulation.stop();
        log.info("Final stats: {}", stats);
        System.out.println(SnapshotJson.toJson(simulation.scheduler().snapshot()));
    }
}

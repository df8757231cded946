package rollout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import patcher.config.PatchConfig;
import patcher.config.PatchConfigLoader;
import patcher.engine.PatchEngine;
import patcher.exceptions.PatchException;

import java.nio.file.Path;
import java.util.List;

/**
 * Rolls structured logging out across a services checkout.
 *
 * <p>Runs four configurations in order, each printing its own report:
 * <ul>
 *   <li>{@code rollout/handlers.yml} - import, error logging, logger field and constructor parameter</li>
 *   <li>{@code rollout/mains.yml} - logger argument on every handler constructor call</li>
 *   <li>{@code rollout/tests.yml} - the same for handler tests</li>
 *   <li>{@code rollout/compose.yml} - healthcheck start period in {@code docker-compose.yml}</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>
 * java -cp logger-rollout.jar rollout.RolloutMain [--dry-run] [root]
 * </pre>
 * The root defaults to the working directory. Re-running on a rolled-out checkout changes nothing.
 */
public class RolloutMain {

    private static final Logger log = LoggerFactory.getLogger(RolloutMain.class);

    static final List<String> STEPS = List.of(
            "rollout/handlers.yml",
            "rollout/mains.yml",
            "rollout/tests.yml",
            "rollout/compose.yml");

    public static void main(String[] args) throws Exception {
        boolean dryRun = false;
        Path root = Path.of(".");
        for (String arg : args) {
            if ("--dry-run".equals(arg)) {
                dryRun = true;
            } else {
                root = Path.of(arg);
            }
        }
        rollout(root, dryRun);
    }

    /**
     * Runs every rollout step against {@code root}.
     *
     * @param root the services checkout
     * @param dryRun report without writing
     * @throws PatchException if a step fails; later steps do not run
     */
    static void rollout(Path root, boolean dryRun) throws PatchException {
        for (String step : STEPS) {
            PatchConfig config = PatchConfigLoader.loadResource(step).withDryRun(dryRun);
            log.info("Running {}", step);

            PatchEngine engine = PatchEngine.fromConfig(config);
            if (!engine.getPlan().isEmpty()) {
                engine.run(root);
            }
            engine.runDocumentPatch(root);
        }

        if (PatchEngine.getLastMetrics() != null) {
            log.info("Last run: {}", PatchEngine.getLastMetrics().summary());
        }
    }
}

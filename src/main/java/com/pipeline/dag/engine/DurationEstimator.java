package com.pipeline.dag.engine;

import com.pipeline.dag.api.Step;

import java.util.List;
import java.util.Locale;

/**
 * Heuristic duration and parallelizability of a job, from its steps alone.
 *
 * <p>
 * Every step costs {@value #SECONDS_PER_STEP}s, plus a bonus picked by the
 * first matching keyword:
 * <ul>
 * <li>action reference containing {@code setup-} or {@code cache}: +30s</li>
 * <li>action reference containing {@code build} or {@code test}: +120s</li>
 * <li>command running {@code npm install} or {@code yarn install}: +60s</li>
 * <li>command containing {@code build}: +120s</li>
 * <li>command containing {@code test}: +90s</li>
 * </ul>
 * The numbers rank jobs against each other; they are not a forecast.
 */
public final class DurationEstimator {
    static final int SECONDS_PER_STEP = 30;
    static final int SETUP_BONUS = 30;
    static final int INSTALL_BONUS = 60;
    static final int ACTION_BUILD_BONUS = 120;
    static final int COMMAND_BUILD_BONUS = 120;
    static final int COMMAND_TEST_BONUS = 90;

    private DurationEstimator() {
        // Utility class
    }

    public static int estimate(List<Step> steps) {
        int total = steps.size() * SECONDS_PER_STEP;
        for (Step step : steps)
            total += bonus(step);
        return total;
    }

    static int bonus(Step step) {
        if (step.hasAction()) {
            String action = step.uses();
            if (action.contains("setup-") || action.contains("cache"))
                return SETUP_BONUS;
            if (action.contains("build") || action.contains("test"))
                return ACTION_BUILD_BONUS;
            return 0;
        }
        if (step.hasCommand()) {
            String cmd = step.run().toLowerCase(Locale.ROOT);
            if (cmd.contains("npm install") || cmd.contains("yarn install"))
                return INSTALL_BONUS;
            if (cmd.contains("build"))
                return COMMAND_BUILD_BONUS;
            if (cmd.contains("test"))
                return COMMAND_TEST_BONUS;
        }
        return 0;
    }

    /** False when any step mentions deploy or release anywhere in its text. */
    public static boolean canParallelize(List<Step> steps) {
        for (Step step : steps) {
            String text = step.serializedText().toLowerCase(Locale.ROOT);
            if (text.contains("deploy") || text.contains("release"))
                return false;
        }
        return true;
    }
}

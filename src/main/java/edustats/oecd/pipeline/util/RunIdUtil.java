package edustats.oecd.pipeline.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Run id handling for pipeline logs.
 * The id lives in SLF4J MDC under "runId" and is printed by the log pattern.
 *
 * Usage:
 * - PipelineService sets it at the start of a run and clears it in finally
 * - Error handlers read it to echo the id back to the caller
 */
public final class RunIdUtil {

    public static final String RUN_ID_KEY = "runId";

    private static final String NO_RUN_ID = "NO-RUN-ID";

    private RunIdUtil() {
    }

    /**
     * Generate a new run id
     * @return short random id, e.g. "3f9a1c2e"
     */
    public static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Gets the current run id from MDC
     * @return run id or "NO-RUN-ID" if not set
     */
    public static String getCurrentRunId() {
        String runId = MDC.get(RUN_ID_KEY);
        return runId != null ? runId : NO_RUN_ID;
    }

    /**
     * Sets a run id in MDC
     * @param runId run id to set
     */
    public static void setRunId(String runId) {
        MDC.put(RUN_ID_KEY, runId);
    }

    /**
     * Removes run id from MDC. Call this in finally blocks.
     */
    public static void clearRunId() {
        MDC.remove(RUN_ID_KEY);
    }

    /**
     * Checks if a run id is set
     * @return true if a run id exists in MDC
     */
    public static boolean hasRunId() {
        return MDC.get(RUN_ID_KEY) != null;
    }
}

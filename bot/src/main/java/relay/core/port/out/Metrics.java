package relay.core.port.out;

import relay.core.model.command.CommandOutcome;

/**
 * Port interface for recording relay metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the outcome of a registration command.
     *
     * @param outcome the outcome
     */
    void recordCommand(CommandOutcome outcome);

    /**
     * Record entries removed by a background sweep.
     *
     * @param removed number of entries removed
     */
    void recordSwept(int removed);
}

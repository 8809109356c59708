package skytiles.acquisition.scheduler;

/**
 * Drives periodic ticks. Implementations never run two ticks at once.
 */
public interface TickSource extends AutoCloseable {

    void start(Runnable tick);

    void stop();

    boolean isRunning();

    @Override
    default void close() {
        stop();
    }
}

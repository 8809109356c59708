package skytiles.acquisition.util;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the submitting thread's MDC (the {@code timestamp} key) onto pool threads.
 */
public final class MdcPropagation {

    public static final String TIMESTAMP_KEY = "timestamp";

    private MdcPropagation() {
    }

    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(context);
            try {
                return task.call();
            } finally {
                apply(previous);
            }
        };
    }

    private static void apply(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}

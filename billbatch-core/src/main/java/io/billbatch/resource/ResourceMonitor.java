package io.billbatch.resource;

/**
 * Answers whether the engine may start another item right now.
 *
 * <p>Throttling is best-effort: implementations must fail open and never block.
 */
@FunctionalInterface
public interface ResourceMonitor {

    boolean checkAdmission();

    static ResourceMonitor alwaysAllow() {
        return () -> true;
    }
}

package io.campus.cli;

@FunctionalInterface
public interface GatewayRunner {
    /**
     * Runs the gateway until the process is stopped.
     *
     * @param portOverride port to bind instead of the configured one, or {@code null}
     */
    int run(Integer portOverride) throws Exception;
}

package org.drinkmap.node.spi;

/**
 * A long-running component hosted by the {@link org.drinkmap.node.Node}.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block for longer than it takes to bring the process up.
     */
    void start();

    /**
     * Stops the process and releases everything it holds.
     */
    void stop();
}

package org.drinkmap.node.spi;

/**
 * Implemented by processes that share a service with processes declared after them.
 * <p>
 * A process declares what it consumes in its {@code require} block; the node passes the
 * exposed service to the consumer's constructor under the local name chosen there.
 */
public interface IServiceProvider {

    /**
     * @return The shared service, or null if the process has nothing to share.
     */
    Object getExposedService();
}

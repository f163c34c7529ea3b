package me.golemcore.coder.port.outbound;

/**
 * Port for publishing domain events to in-process listeners.
 */
public interface EventBusPort {

    void publish(Object event);
}

package com.myorg.ebus.eventing;

import java.util.List;

/**
 * Handles a pulled batch as a unit: the whole batch is acknowledged or
 * negatively acknowledged together.
 */
@FunctionalInterface
public interface BatchEventHandler<T> {
    boolean handle(List<T> events, CancellationToken cancellationToken) throws Exception;
}

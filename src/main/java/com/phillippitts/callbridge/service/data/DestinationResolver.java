package com.phillippitts.callbridge.service.data;

import com.phillippitts.callbridge.domain.TransferDestination;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves transfer destination keys (e.g. {@code "sales"}) to routing addresses.
 */
public interface DestinationResolver {

    Optional<TransferDestination> resolve(String key);

    /**
     * All configured destinations keyed by lookup key, in a stable order.
     */
    Map<String, TransferDestination> all();
}

package com.testfleet.supervisor;

import com.testfleet.core.model.ServiceInstance;

/**
 * One readiness check of a starting service. Implementations never throw;
 * any error counts as "not ready yet".
 */
@FunctionalInterface
public interface ReadinessProbe {

    boolean check(ServiceInstance instance);
}

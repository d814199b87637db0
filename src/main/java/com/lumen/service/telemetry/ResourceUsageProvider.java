package com.lumen.service.telemetry;

import com.lumen.model.telemetry.ResourceUsage;

/**
 * Source of resource figures attached to telemetry events.
 */
public interface ResourceUsageProvider {

    /**
     * Current figures. Must be cheap; called on every recorded event.
     */
    ResourceUsage current();
}

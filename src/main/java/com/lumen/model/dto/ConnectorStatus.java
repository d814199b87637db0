package com.lumen.model.dto;

import com.lumen.model.RuntimeHealth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Connector view: connection state, last health snapshot and effective runtime settings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectorStatus {

    private boolean connected;
    private RuntimeHealth health;
    private String baseUrl;
    private String defaultModel;
    private long timeoutMs;
    private long healthCheckIntervalMs;
}

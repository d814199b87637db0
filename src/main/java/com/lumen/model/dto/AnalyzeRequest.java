package com.lumen.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {
    /**
     * Window such as "6h", "2d" or "1w".
     */
    private String timeframe = "24h";
}

package com.lumen.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One NDJSON line of a streamed generation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamFragment {

    private String response;
}

package com.lumen.model.dto;

import com.lumen.model.telemetry.LearningTrack;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /v1/telemetry/train-models}. All tracks are trained when
 * {@code tracks} is empty.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrainModelsRequest {
    private List<LearningTrack> tracks;
}

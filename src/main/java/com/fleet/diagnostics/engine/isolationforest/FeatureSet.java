package com.fleet.diagnostics.engine.isolationforest;

import lombok.Value;

import java.util.List;

/**
 * The complete feature vectors of one unit, in cycle order, over a fixed
 * ordered sensor list.
 */
@Value
public class FeatureSet {

    String unitId;

    List<String> sensors;

    List<FeatureVector> vectors;
}

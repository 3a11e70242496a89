package com.flowline.coordinator.model;

import java.util.List;

/** Inputs and explicit outputs of one build; both lists may be empty. */
public record BuildResources(List<BuildInput> inputs, List<BuildOutput> outputs) {

    public BuildResources {
        inputs  = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }
}

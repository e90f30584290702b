package com.pipeline.model;

import com.pipeline.model.transform.WrapSpec;

import java.util.Optional;

/**
 * The {@code merge} block of a pipeline.
 *
 * @param mode                  how outcomes are reconciled
 * @param sourceTag             tag concatenated objects with the id of the step that produced them
 * @param wrap                  optional envelope around the merged value
 * @param preserveDeclaredOrder merge outcomes in declared step order instead of completion order
 */
public record MergeConfig(MergeMode mode, boolean sourceTag, Optional<WrapSpec> wrap, boolean preserveDeclaredOrder) {

    public static final MergeConfig DEFAULT = new MergeConfig(MergeMode.CONCAT, false, Optional.empty(), false);

    public MergeConfig withPreserveDeclaredOrder(boolean preserve) {
        return new MergeConfig(mode, sourceTag, wrap, preserve);
    }
}

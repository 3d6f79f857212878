package com.example.demo.shortcuts.model;

/**
 * Common shape of every by-name reference a template makes into the schema.
 * An explicit suffix on the reference overrides the suffix of the output
 * being built; the optional condition gates the whole reference.
 */
public interface SchemaReference {

    String getName();

    String getSuffix();

    String getCondition();

    default String effectiveSuffix(String outputSuffix) {
        String own = getSuffix();
        return own != null && !own.isEmpty() ? own : (outputSuffix != null ? outputSuffix : "");
    }
}

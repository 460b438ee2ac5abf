package com.namingtool.model.naming;

/**
 * One component's part in a composed name: the component name and the label recorded in history.
 */
public record ComponentContribution(
    String componentName,
    String valueLabel
) {}

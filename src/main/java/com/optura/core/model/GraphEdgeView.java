package com.optura.core.model;

/**
 * Edge from a prerequisite ({@code from}) to its dependent ({@code to}).
 */
public record GraphEdgeView(long from, long to) {}

package io.github.koszti.segmentstore.pipeline;

public record WriteResult(String fileId, String name, long size, int segmentCount) {}

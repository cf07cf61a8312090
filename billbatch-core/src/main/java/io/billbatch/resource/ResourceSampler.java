package io.billbatch.resource;

@FunctionalInterface
public interface ResourceSampler {

    ResourceUsage sample() throws Exception;
}

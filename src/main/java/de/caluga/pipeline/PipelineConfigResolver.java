package de.caluga.pipeline;

@FunctionalInterface
public interface PipelineConfigResolver {
    Object resolveSetting(String settingName);
}

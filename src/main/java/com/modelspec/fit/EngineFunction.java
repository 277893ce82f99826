package com.modelspec.fit;

import java.util.Map;

/**
 * A fitting or prediction routine of an engine, invoked with named arguments.
 */
@FunctionalInterface
public interface EngineFunction {

    Object invoke(Map<String, Object> arguments) throws Exception;
}

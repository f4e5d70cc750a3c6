package dev.flows.condition;

/**
 * A typed object readable from a condition. Unknown properties read as {@code undefined}.
 */
interface ScriptObject {

    Object property(String name);
}

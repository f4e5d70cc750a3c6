package dev.flows.condition;

@FunctionalInterface
interface ScriptFunction {

    Object call(Object argument);
}

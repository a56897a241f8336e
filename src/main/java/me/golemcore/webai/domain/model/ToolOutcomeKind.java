package me.golemcore.webai.domain.model;

/**
 * Machine-readable classification of a single tool invocation.
 *
 * <p>
 * Every invocation ends in exactly one kind.
 */
public enum ToolOutcomeKind {

    /**
     * The tool completed before its deadline and returned output (possibly empty
     * text).
     */
    SUCCESS,

    /**
     * The deadline passed first. The tool was abandoned, its late result is
     * discarded.
     */
    TIMEOUT,

    /**
     * The tool failed on its own before the deadline.
     */
    ERROR
}

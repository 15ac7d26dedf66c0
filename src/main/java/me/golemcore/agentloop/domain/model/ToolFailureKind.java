package me.golemcore.agentloop.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * No tool is registered under the requested name.
     */
    NOT_FOUND,

    /**
     * Parameters did not satisfy the tool's input schema.
     */
    VALIDATION_FAILED,

    /**
     * The tool did not complete before its deadline elapsed.
     */
    DEADLINE_EXCEEDED,

    /**
     * The call was cancelled by the caller. Never used for deadline expiry.
     */
    CANCELLED,

    /**
     * Tool execution failed during runtime.
     */
    EXECUTION_FAILED
}

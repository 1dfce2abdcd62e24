package io.mcpdeck.protocol;

/**
 * {@code code} values carried by error envelopes.
 */
public final class ErrorCodes {
    public static final String FUNCTION_NOT_FOUND = "function_not_found";
    public static final String FUNCTION_EXECUTION_ERROR = "function_execution_error";
    public static final String CONTEXT_NOT_FOUND = "context_not_found";
    public static final String MCP_PROCESSING_ERROR = "mcp_processing_error";
    public static final String MISSING_LLM_CONFIG = "missing_llm_config";
    public static final String PROVIDER_NOT_SUPPORTED = "provider_not_supported";
    public static final String LLM_CONNECTION_ERROR = "llm_connection_error";

    private ErrorCodes() {
    }
}

/**
 * Runtime assembly.
 *
 * <p>{@link io.mcpdeck.runtime.McpRuntime} owns the lifecycle of one data root: manifest and
 * context stores, the process supervisor, the function registry and dispatcher, and the status
 * broadcaster used by the CLI and the web control surface.
 */
package io.mcpdeck.runtime;

/**
 * mcpdeck source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.mcpdeck.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.mcpdeck.cli.McpDeckCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.mcpdeck.supervisor.ProcessSupervisor} owns the child server processes.</li>
 *   <li>{@code io.mcpdeck.protocol.McpDispatcher} routes message envelopes.</li>
 * </ul>
 */
package io.mcpdeck;

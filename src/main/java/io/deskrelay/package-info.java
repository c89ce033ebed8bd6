/**
 * DeskRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.deskrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.deskrelay.cli.DeskRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.deskrelay.runtime.DeskRelayRuntime} wires creation, delegation and processing.</li>
 *   <li>{@code io.deskrelay.storage.SqliteRemoteTaskStore} is the shared record store machines sync through.</li>
 * </ul>
 */
package io.deskrelay;

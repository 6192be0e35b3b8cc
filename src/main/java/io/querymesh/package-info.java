/**
 * QueryMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.querymesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.querymesh.cli.QueryMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.querymesh.runtime.Dispatcher} turns input files into a session of sharded tasks.</li>
 *   <li>{@code io.querymesh.runtime.Worker} runs one delivery: convert, append, record, acknowledge.</li>
 *   <li>{@code io.querymesh.storage.SessionStore} is the authoritative progress store.</li>
 *   <li>{@code io.querymesh.table.SharedTableWriter} is the only writer of the shared result table.</li>
 * </ul>
 */
package io.querymesh;

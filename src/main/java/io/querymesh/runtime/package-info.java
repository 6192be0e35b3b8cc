/**
 * Runtime orchestration package.
 *
 * <p>{@link io.querymesh.runtime.QueryMeshRuntime} wires the stores for one root;
 * {@link io.querymesh.runtime.Dispatcher} creates sessions; {@link io.querymesh.runtime.Worker}
 * and {@link io.querymesh.runtime.WorkerPool} drain the task queue with retry and time limits.
 */
package io.querymesh.runtime;
